package com.chainindexer.ingestion.adapter.model;

import java.util.List;

public record TxResult(int code, List<ChainEvent> events) {

    public TxResult {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
