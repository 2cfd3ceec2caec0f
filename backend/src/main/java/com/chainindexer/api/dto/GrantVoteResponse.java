package com.chainindexer.api.dto;

import com.chainindexer.domain.GrantVote;

public record GrantVoteResponse(
        long id,
        long proposerIndex,
        String proposerAddress,
        long accountIndex,
        String accountAddress,
        long voterIndex,
        String voterAddress,
        long height,
        long vote
) {

    public static GrantVoteResponse from(GrantVote v) {
        return new GrantVoteResponse(v.getId(), v.getProposerIndex(), v.getProposerAddress(),
                v.getAccountIndex(), v.getAccountAddress(), v.getVoterIndex(), v.getVoterAddress(),
                v.getHeight(), v.getVote());
    }
}
