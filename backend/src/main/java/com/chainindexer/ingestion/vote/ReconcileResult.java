package com.chainindexer.ingestion.vote;

/**
 * Outcome of reconciling one height. targetId is the proposal id or granted validator index; skipped counts
 * absent signers and signers that already had a vote row.
 */
public record ReconcileResult(long height, VoteKind kind, long targetId, int inserted, int skipped) {

    public static ReconcileResult none(long height) {
        return new ReconcileResult(height, VoteKind.NONE, 0L, 0, 0);
    }
}
