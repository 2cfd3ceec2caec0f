package com.chainindexer.ingestion.decoder;

public record ProposalEvent(long proposal, long proposer, String proposerAddress, byte[] data, long status) {
}
