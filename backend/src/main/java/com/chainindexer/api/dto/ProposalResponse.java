package com.chainindexer.api.dto;

import com.chainindexer.domain.Proposal;

import java.util.HexFormat;

/**
 * Proposal view; data is hex. settleHeight is 0 while the proposal is open.
 */
public record ProposalResponse(
        long id,
        long proposerIndex,
        String proposerAddress,
        String data,
        long newHeight,
        long settleHeight,
        long status,
        boolean settled
) {

    public static ProposalResponse from(Proposal p) {
        return new ProposalResponse(
                p.getId(),
                p.getProposerIndex(),
                p.getProposerAddress(),
                p.getData() != null ? HexFormat.of().formatHex(p.getData()) : "",
                p.getNewHeight(),
                p.getSettleHeight(),
                p.getStatus(),
                p.isSettled());
    }
}
