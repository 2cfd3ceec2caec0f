package com.chainindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the index_progress singleton. Written only by IndexProgressTracker.
 */
public interface IndexProgressRepository extends MongoRepository<IndexProgress, Long> {
}
