package com.chainindexer.ingestion.sync;

import java.time.Instant;

/**
 * Point-in-time view of the sync loop for the status endpoint. chainHead is -1 until the first head fetch.
 */
public record SyncStatusSnapshot(
        SyncState state,
        long nextHeight,
        long chainHead,
        String endpoint,
        String lastError,
        Instant lastTickAt
) {
}
