package com.chainindexer.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProposalVoteRepository extends MongoRepository<ProposalVote, Long> {

    boolean existsByHeightAndVoterIndex(long height, long voterIndex);

    Page<ProposalVote> findByProposal(long proposal, Pageable pageable);

    Page<ProposalVote> findByVoterAddress(String voterAddress, Pageable pageable);
}
