package com.chainindexer.ingestion.job;

import com.chainindexer.ingestion.config.SyncProperties;
import com.chainindexer.ingestion.sync.ChainSyncLoop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ChainSyncJobTest {

    @Mock
    private ChainSyncLoop chainSyncLoop;

    @Test
    void runScheduled_ticksLoop() {
        ChainSyncJob job = new ChainSyncJob(chainSyncLoop, new SyncProperties());

        job.runScheduled();

        verify(chainSyncLoop).tick();
    }

    @Test
    void runScheduled_disabled_doesNothing() {
        SyncProperties properties = new SyncProperties();
        properties.setEnabled(false);
        ChainSyncJob job = new ChainSyncJob(chainSyncLoop, properties);

        job.runScheduled();

        verifyNoInteractions(chainSyncLoop);
    }
}
