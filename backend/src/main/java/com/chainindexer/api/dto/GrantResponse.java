package com.chainindexer.api.dto;

import com.chainindexer.domain.Grant;

import java.math.BigDecimal;

/**
 * Latest grant decision for a validator; id is the validator index.
 */
public record GrantResponse(
        long id,
        String address,
        long height,
        BigDecimal stake,
        long proposerIndex,
        String proposerAddress,
        boolean grant
) {

    public static GrantResponse from(Grant g) {
        return new GrantResponse(g.getId(), g.getAddress(), g.getHeight(), g.getStake(),
                g.getProposerIndex(), g.getProposerAddress(), g.isGrant());
    }
}
