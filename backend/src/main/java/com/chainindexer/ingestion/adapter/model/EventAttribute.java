package com.chainindexer.ingestion.adapter.model;

public record EventAttribute(String key, String value) {
}
