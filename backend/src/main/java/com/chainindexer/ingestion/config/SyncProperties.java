package com.chainindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sync loop timing. The tick interval bounds how fast a failing height is retried; the catch-up delay spaces
 * heights while behind the chain head.
 */
@ConfigurationProperties(prefix = "chainindexer.ingestion.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Run the scheduled sync job. Default true. */
    private boolean enabled = true;

    /** Delay between ticks in ms. Default 1000. */
    private long tickIntervalMs = 1_000L;

    /** Pause between two heights during catch-up in ms. Default 100. */
    private long catchUpDelayMs = 100L;

    /** First height to index on an empty store. Ignored once persisted progress is past it. Default 1. */
    private long startHeight = 1L;
}
