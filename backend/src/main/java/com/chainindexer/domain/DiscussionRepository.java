package com.chainindexer.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DiscussionRepository extends MongoRepository<Discussion, Long> {

    Page<Discussion> findByProposal(long proposal, Pageable pageable);

    boolean existsByHeightAndProposalAndSpeakerIndexAndData(long height, long proposal, long speakerIndex, byte[] data);
}
