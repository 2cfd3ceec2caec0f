package com.chainindexer.advisory;

/**
 * Agent's non-binding recommendation: vote is "yes" or "no", reason is free text.
 */
public record VoteRecommendation(String vote, String reason) {

    public static final String YES = "yes";
    public static final String NO = "no";

    public boolean approved() {
        return YES.equalsIgnoreCase(vote);
    }

    public static VoteRecommendation yes(String reason) {
        return new VoteRecommendation(YES, reason);
    }
}
