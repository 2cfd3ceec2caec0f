package com.chainindexer.api.controller;

import com.chainindexer.api.dto.IndexerStatusResponse;
import com.chainindexer.ingestion.sync.ChainSyncLoop;
import com.chainindexer.ingestion.sync.progress.IndexProgressTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Sync loop health for operators.
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class IndexerStatusController {

    private final ChainSyncLoop chainSyncLoop;
    private final IndexProgressTracker indexProgressTracker;

    @GetMapping("/status")
    public ResponseEntity<IndexerStatusResponse> getStatus() {
        return ResponseEntity.ok(IndexerStatusResponse.from(
                chainSyncLoop.status(), indexProgressTracker.lastIndexedHeight()));
    }
}
