package com.chainindexer.ingestion.adapter.model;

/**
 * Response of an abci_query point lookup. code 0 means success; value is the raw payload (may be empty).
 */
public record AbciQueryResult(long code, byte[] value, String log) {

    public boolean isOk() {
        return code == 0;
    }

    public boolean hasValue() {
        return value != null && value.length > 0;
    }
}
