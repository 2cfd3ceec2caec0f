package com.chainindexer.ingestion.sync;

import com.chainindexer.ingestion.adapter.ChainConnection;
import com.chainindexer.ingestion.adapter.CometRpcService;
import com.chainindexer.ingestion.adapter.model.BlockResults;
import com.chainindexer.ingestion.adapter.model.ChainEvent;
import com.chainindexer.ingestion.adapter.model.TxResult;
import com.chainindexer.ingestion.config.SyncProperties;
import com.chainindexer.ingestion.dispatch.ChainEventDispatcher;
import com.chainindexer.ingestion.sync.progress.IndexProgressTracker;
import com.chainindexer.ingestion.vote.ReconcileResult;
import com.chainindexer.ingestion.vote.VoteReconciler;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Follows the chain head one height at a time. For each height: dispatch every event of every tx result in
 * order, reconcile commit votes, then persist progress. Any failure aborts the tick before progress is written,
 * so the same height is retried on the next tick.
 *
 * <p>Called only from the single scheduler thread; the status fields are volatile for the status endpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChainSyncLoop {

    private final ChainConnection chainConnection;
    private final CometRpcService cometRpcService;
    private final ChainEventDispatcher chainEventDispatcher;
    private final VoteReconciler voteReconciler;
    private final IndexProgressTracker indexProgressTracker;
    private final SyncProperties syncProperties;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private volatile SyncState state = SyncState.IDLE;
    /** 0 until resumed from persisted progress. */
    private volatile long nextHeight;
    private volatile long chainHead = -1L;
    private volatile String lastError;
    private volatile Instant lastTickAt;

    public void tick() {
        if (shutdown.get()) {
            return;
        }
        lastTickAt = Instant.now();
        try {
            if (nextHeight == 0L) {
                resume();
            }
            if (!chainConnection.isHealthy()) {
                chainConnection.ensureConnected();
            }
            state = SyncState.FETCHING_HEAD;
            long head = cometRpcService.currentHeight();
            chainHead = head;
            while (nextHeight < head) {
                if (shutdown.get()) {
                    return;
                }
                state = SyncState.CATCHING_UP;
                processHeight(nextHeight);
                nextHeight++;
                if (nextHeight < head && !pause()) {
                    return;
                }
            }
            state = SyncState.SYNCED;
            lastError = null;
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Sync tick aborted at height {}: {}", nextHeight, e.getMessage(), e);
        } finally {
            state = SyncState.IDLE;
        }
    }

    /**
     * Picks the first height to index: one past persisted progress, raised to the configured start height.
     */
    void resume() {
        long last = indexProgressTracker.lastIndexedHeight();
        nextHeight = Math.max(last + 1, Math.max(1L, syncProperties.getStartHeight()));
        log.info("Sync resuming at height {} (last indexed {})", nextHeight, last);
    }

    void processHeight(long height) {
        log.debug("Indexing height {}", height);
        BlockResults results = cometRpcService.blockResults(height);
        for (TxResult tx : results.txResults()) {
            for (ChainEvent event : tx.events()) {
                chainEventDispatcher.dispatch(event.type(), event, height);
            }
        }
        ReconcileResult reconciled = voteReconciler.reconcile(height);
        indexProgressTracker.markIndexed(height);
        if (height % 1000 == 0 || reconciled.inserted() > 0) {
            log.info("Indexed height {} ({} votes)", height, reconciled.inserted());
        }
    }

    private boolean pause() {
        long delay = syncProperties.getCatchUpDelayMs();
        if (delay <= 0) {
            return !shutdown.get();
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown.set(true);
            return false;
        }
        return !shutdown.get();
    }

    @PreDestroy
    public void stop() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Sync loop stopping at height {}", nextHeight);
        }
    }

    public boolean isStopped() {
        return shutdown.get();
    }

    public SyncStatusSnapshot status() {
        return new SyncStatusSnapshot(state, nextHeight, chainHead, chainConnection.currentEndpoint(), lastError, lastTickAt);
    }
}
