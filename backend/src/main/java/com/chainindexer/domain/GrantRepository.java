package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface GrantRepository extends MongoRepository<Grant, Long> {

    Optional<Grant> findFirstByHeight(long height);
}
