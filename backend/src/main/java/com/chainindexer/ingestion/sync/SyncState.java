package com.chainindexer.ingestion.sync;

public enum SyncState {
    IDLE,
    FETCHING_HEAD,
    CATCHING_UP,
    SYNCED
}
