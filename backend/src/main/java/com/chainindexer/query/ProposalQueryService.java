package com.chainindexer.query;

import com.chainindexer.domain.Discussion;
import com.chainindexer.domain.DiscussionRepository;
import com.chainindexer.domain.Proposal;
import com.chainindexer.domain.ProposalRepository;
import com.chainindexer.domain.ProposalVote;
import com.chainindexer.domain.ProposalVoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Read-only proposal views: the proposal list, one proposal, and its discussions and votes.
 */
@Service
@RequiredArgsConstructor
public class ProposalQueryService {

    private final ProposalRepository proposalRepository;
    private final DiscussionRepository discussionRepository;
    private final ProposalVoteRepository proposalVoteRepository;
    private final PageRequests pageRequests;

    /**
     * @param proposer optional proposer address filter; blank means all proposals
     */
    public ResultPage<Proposal> findProposals(Integer page, Integer size, String proposer) {
        Pageable pageable = pageRequests.newestFirst(page, size);
        Page<Proposal> result = proposer == null || proposer.isBlank()
                ? proposalRepository.findAll(pageable)
                : proposalRepository.findByProposerAddress(proposer.strip(), pageable);
        return ResultPage.of(result);
    }

    public Proposal getProposal(long id) {
        return proposalRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Proposal", id));
    }

    public ResultPage<Discussion> findDiscussions(long proposalId, Integer page, Integer size) {
        Pageable pageable = pageRequests.newestFirst(page, size);
        requireProposal(proposalId);
        return ResultPage.of(discussionRepository.findByProposal(proposalId, pageable));
    }

    public ResultPage<ProposalVote> findVotes(long proposalId, Integer page, Integer size) {
        Pageable pageable = pageRequests.newestFirst(page, size);
        requireProposal(proposalId);
        return ResultPage.of(proposalVoteRepository.findByProposal(proposalId, pageable));
    }

    private void requireProposal(long id) {
        if (!proposalRepository.existsById(id)) {
            throw new EntityNotFoundException("Proposal", id);
        }
    }
}
