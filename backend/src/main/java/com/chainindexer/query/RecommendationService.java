package com.chainindexer.query;

import com.chainindexer.advisory.AdvisoryAgentClient;
import com.chainindexer.advisory.VoteRecommendation;
import com.chainindexer.domain.Grant;
import com.chainindexer.domain.Proposal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * On-demand vote recommendations from the advisory agent for stored proposals and grants. Agent failures
 * propagate as AgentException.
 */
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final ProposalQueryService proposalQueryService;
    private final GrantQueryService grantQueryService;
    private final AdvisoryAgentClient advisoryAgentClient;

    public VoteRecommendation recommendProposalVote(long proposalId, String voterAddress) {
        Proposal proposal = proposalQueryService.getProposal(proposalId);
        return advisoryAgentClient.recommendProposalVote(proposal.getId(), voterAddress);
    }

    public VoteRecommendation recommendGrantVote(long grantId, String statement) {
        Grant grant = grantQueryService.getGrant(grantId);
        return advisoryAgentClient.recommendGrantVote(grant.getId(), grant.getProposerAddress(), grant.getStake(),
                statement == null ? "" : statement);
    }
}
