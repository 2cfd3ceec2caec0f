package com.chainindexer.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.FindAndModifyOptions.options;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Allocates increasing ids with an atomic findAndModify on database_sequences. The first id of a sequence is 1.
 */
@Repository
@RequiredArgsConstructor
public class SequenceGenerator {

    private final MongoTemplate mongoTemplate;

    public long next(String sequenceName) {
        DatabaseSequence counter = mongoTemplate.findAndModify(
                new Query(where("_id").is(sequenceName)),
                new Update().inc("seq", 1),
                options().returnNew(true).upsert(true),
                DatabaseSequence.class);
        return counter != null ? counter.getSeq() : 1L;
    }
}
