package com.chainindexer.advisory;

/**
 * Thrown when the advisory agent cannot be reached or answers with something unusable.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
