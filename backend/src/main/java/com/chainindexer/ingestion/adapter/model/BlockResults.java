package com.chainindexer.ingestion.adapter.model;

import java.util.List;

/**
 * Results of executing one block, tx results in block order.
 */
public record BlockResults(long height, List<TxResult> txResults) {

    public BlockResults {
        txResults = txResults == null ? List.of() : List.copyOf(txResults);
    }
}
