package com.chainindexer.ingestion.dispatch;

import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventType;

/**
 * Handles one event type. Implementations decode the raw event themselves and skip it when malformed.
 */
public interface ChainEventHandler {

    ChainEventType eventType();

    void handle(ChainEvent event, long height);
}
