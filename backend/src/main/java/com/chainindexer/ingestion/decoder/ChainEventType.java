package com.chainindexer.ingestion.decoder;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event type tags emitted by the governance application.
 */
public enum ChainEventType {
    GRANT("grant"),
    DISCUSSION("discussion"),
    PROPOSAL("proposal"),
    SETTLE_PROPOSAL("settle_proposal");

    private final String tag;

    ChainEventType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<ChainEventType> fromTag(String tag) {
        return Arrays.stream(values()).filter(t -> t.tag.equals(tag)).findFirst();
    }
}
