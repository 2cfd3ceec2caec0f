package com.chainindexer.ingestion.dispatch;

import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.decoder.ChainEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes raw chain events to the handler registered for their type tag. The routing table is built once from
 * all {@link ChainEventHandler} beans; two handlers for the same type fail startup.
 *
 * <p>A handler failure is logged and swallowed here so sibling events at the same height still run.
 */
@Component
@Slf4j
public class ChainEventDispatcher {

    private final Map<ChainEventType, ChainEventHandler> handlers;

    public ChainEventDispatcher(List<ChainEventHandler> handlers) {
        Map<ChainEventType, ChainEventHandler> byType = new EnumMap<>(ChainEventType.class);
        for (ChainEventHandler handler : handlers) {
            ChainEventHandler previous = byType.putIfAbsent(handler.eventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for event type " + handler.eventType().tag()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byType);
    }

    public void dispatch(String eventType, ChainEvent event, long height) {
        ChainEventHandler handler = ChainEventType.fromTag(eventType).map(handlers::get).orElse(null);
        if (handler == null) {
            log.debug("No handler for event type {} at height {}", eventType, height);
            return;
        }
        try {
            handler.handle(event, height);
        } catch (RuntimeException e) {
            log.warn("Handler for {} failed at height {}: {}", eventType, height, e.getMessage(), e);
        }
    }
}
