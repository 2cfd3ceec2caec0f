package com.chainindexer.query;

/**
 * Requested record is not in the store. Rendered as 404.
 */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String entity, Object id) {
        super(entity + " " + id + " not found");
    }
}
