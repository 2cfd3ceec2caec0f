package com.chainindexer.ingestion.decoder;

public record SettleProposalEvent(long proposal, long state) {
}
