package com.chainindexer.ingestion.adapter.model;

import java.util.List;

/**
 * Raw ABCI event as emitted by the application: a type tag and a flat attribute list in emission order.
 */
public record ChainEvent(String type, List<EventAttribute> attributes) {

    public ChainEvent {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
