package com.chainindexer.ingestion.adapter.model;

import java.util.List;

public record Commit(long height, List<CommitSignature> signatures) {

    public Commit {
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }
}
