package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ValidatorRepository extends MongoRepository<Validator, Long> {
}
