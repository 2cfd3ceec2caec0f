package com.chainindexer.ingestion.sync.progress;

import com.chainindexer.domain.IndexProgress;
import com.chainindexer.domain.IndexProgressRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Reads and advances the index_progress singleton. Progress never moves backwards.
 */
@Component
@RequiredArgsConstructor
public class IndexProgressTracker {

    private final IndexProgressRepository indexProgressRepository;

    /**
     * Last fully indexed height, 0 when nothing was indexed yet.
     */
    public long lastIndexedHeight() {
        return indexProgressRepository.findById(IndexProgress.SINGLETON_ID)
                .map(IndexProgress::getHeight)
                .orElse(0L);
    }

    /**
     * Records that every event and vote of the given height is stored. Re-marking the current height is a no-op
     * write; a lower height is rejected.
     */
    public void markIndexed(long height) {
        IndexProgress progress = indexProgressRepository.findById(IndexProgress.SINGLETON_ID)
                .orElseGet(IndexProgress::initial);
        if (height < progress.getHeight()) {
            throw new IllegalStateException("Progress would move back from " + progress.getHeight() + " to " + height);
        }
        progress.setHeight(height);
        progress.setUpdatedAt(Instant.now());
        indexProgressRepository.save(progress);
    }
}
