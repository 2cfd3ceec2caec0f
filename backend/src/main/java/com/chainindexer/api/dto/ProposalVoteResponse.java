package com.chainindexer.api.dto;

import com.chainindexer.domain.ProposalVote;

public record ProposalVoteResponse(long id, long proposal, long voterIndex, String voterAddress, long height, long vote) {

    public static ProposalVoteResponse from(ProposalVote v) {
        return new ProposalVoteResponse(v.getId(), v.getProposal(), v.getVoterIndex(), v.getVoterAddress(),
                v.getHeight(), v.getVote());
    }
}
