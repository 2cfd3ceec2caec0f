package com.chainindexer.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for proposals. Height lookups are used by VoteReconciler; paged queries by the read API.
 */
public interface ProposalRepository extends MongoRepository<Proposal, Long> {

    Optional<Proposal> findFirstByNewHeight(long newHeight);

    Optional<Proposal> findFirstBySettleHeight(long settleHeight);

    Page<Proposal> findByProposerAddress(String proposerAddress, Pageable pageable);
}
