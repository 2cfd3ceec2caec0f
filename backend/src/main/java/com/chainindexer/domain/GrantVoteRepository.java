package com.chainindexer.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface GrantVoteRepository extends MongoRepository<GrantVote, Long> {

    boolean existsByHeightAndVoterIndex(long height, long voterIndex);

    Page<GrantVote> findByAccountIndex(long accountIndex, Pageable pageable);

    Page<GrantVote> findByVoterAddress(String voterAddress, Pageable pageable);
}
