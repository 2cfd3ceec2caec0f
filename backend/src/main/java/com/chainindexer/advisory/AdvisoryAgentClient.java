package com.chainindexer.advisory;

import java.math.BigDecimal;

/**
 * Handle to the single configured advisory agent. Implementations: {@link HttpAdvisoryAgentClient} for a real
 * agent, {@link NoOpAdvisoryAgentClient} when none is configured.
 */
public interface AdvisoryAgentClient {

    /** Feed a newly created proposal's text to the agent. */
    void submitProposal(long proposalId, String proposerAddress, String text);

    /** Feed a new discussion message on a proposal to the agent. */
    void submitDiscussion(long proposalId, String speakerAddress, String text);

    /** Ask the agent to comment on a proposal; returns the comment text. */
    String commentProposal(long proposalId, String speakerAddress);

    VoteRecommendation recommendProposalVote(long proposalId, String voterAddress);

    VoteRecommendation recommendGrantVote(long validatorIndex, String proposerAddress, BigDecimal amount, String statement);
}
