package com.chainindexer.api.dto;

import com.chainindexer.domain.Validator;

import java.math.BigDecimal;

public record ValidatorResponse(long index, String address, String agentUrl, BigDecimal stake) {

    public static ValidatorResponse from(Validator v) {
        return new ValidatorResponse(v.getId(), v.getAddress(), v.getAgentUrl(), v.getStake());
    }
}
