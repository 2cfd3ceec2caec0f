package com.chainindexer.ingestion.job;

import com.chainindexer.ingestion.config.SyncProperties;
import com.chainindexer.ingestion.sync.ChainSyncLoop;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the sync loop on the single scheduler thread. Fixed delay, so ticks never overlap.
 */
@Component
@RequiredArgsConstructor
public class ChainSyncJob {

    private final ChainSyncLoop chainSyncLoop;
    private final SyncProperties syncProperties;

    @Scheduled(fixedDelayString = "${chainindexer.ingestion.sync.tick-interval-ms:1000}")
    public void runScheduled() {
        if (!syncProperties.isEnabled()) {
            return;
        }
        chainSyncLoop.tick();
    }
}
