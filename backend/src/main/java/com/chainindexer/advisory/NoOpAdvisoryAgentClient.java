package com.chainindexer.advisory;

import java.math.BigDecimal;

/**
 * Used when no agent URL is configured: drops submissions and approves everything.
 */
public class NoOpAdvisoryAgentClient implements AdvisoryAgentClient {

    static final String REASON = "no advisory agent configured";

    @Override
    public void submitProposal(long proposalId, String proposerAddress, String text) {
    }

    @Override
    public void submitDiscussion(long proposalId, String speakerAddress, String text) {
    }

    @Override
    public String commentProposal(long proposalId, String speakerAddress) {
        return "";
    }

    @Override
    public VoteRecommendation recommendProposalVote(long proposalId, String voterAddress) {
        return VoteRecommendation.yes(REASON);
    }

    @Override
    public VoteRecommendation recommendGrantVote(long validatorIndex, String proposerAddress, BigDecimal amount, String statement) {
        return VoteRecommendation.yes(REASON);
    }
}
