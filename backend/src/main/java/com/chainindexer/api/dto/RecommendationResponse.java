package com.chainindexer.api.dto;

import com.chainindexer.advisory.VoteRecommendation;

public record RecommendationResponse(String vote, String reason, boolean approved) {

    public static RecommendationResponse from(VoteRecommendation r) {
        return new RecommendationResponse(r.vote(), r.reason(), r.approved());
    }
}
