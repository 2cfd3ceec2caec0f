package com.chainindexer.ingestion.decoder;

public record DiscussionEvent(long proposal, long speaker, String speakerAddress, byte[] data) {
}
