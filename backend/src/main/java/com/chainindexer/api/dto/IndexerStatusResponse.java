package com.chainindexer.api.dto;

import com.chainindexer.ingestion.sync.SyncStatusSnapshot;

import java.time.Instant;

/**
 * Sync loop state. indexedHeight is the persisted progress; chainHead is -1 before the first head fetch.
 */
public record IndexerStatusResponse(
        String state,
        long indexedHeight,
        long nextHeight,
        long chainHead,
        String endpoint,
        String lastError,
        Instant lastTickAt
) {

    public static IndexerStatusResponse from(SyncStatusSnapshot s, long indexedHeight) {
        return new IndexerStatusResponse(s.state().name(), indexedHeight, s.nextHeight(), s.chainHead(),
                s.endpoint(), s.lastError(), s.lastTickAt());
    }
}
