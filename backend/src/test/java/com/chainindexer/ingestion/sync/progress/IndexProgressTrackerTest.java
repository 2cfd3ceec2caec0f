package com.chainindexer.ingestion.sync.progress;

import com.chainindexer.domain.IndexProgress;
import com.chainindexer.domain.IndexProgressRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexProgressTrackerTest {

    @Mock
    private IndexProgressRepository indexProgressRepository;

    @InjectMocks
    private IndexProgressTracker tracker;

    private static IndexProgress progressAt(long height) {
        IndexProgress progress = IndexProgress.initial();
        progress.setHeight(height);
        return progress;
    }

    @Test
    @DisplayName("no stored progress means height 0")
    void emptyStoreIsZero() {
        when(indexProgressRepository.findById(IndexProgress.SINGLETON_ID)).thenReturn(Optional.empty());

        assertThat(tracker.lastIndexedHeight()).isZero();
    }

    @Test
    @DisplayName("markIndexed creates the singleton on first write")
    void firstWriteCreatesSingleton() {
        when(indexProgressRepository.findById(IndexProgress.SINGLETON_ID)).thenReturn(Optional.empty());

        tracker.markIndexed(1L);

        ArgumentCaptor<IndexProgress> captor = ArgumentCaptor.forClass(IndexProgress.class);
        verify(indexProgressRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(IndexProgress.SINGLETON_ID);
        assertThat(captor.getValue().getHeight()).isEqualTo(1L);
        assertThat(captor.getValue().getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("markIndexed advances existing progress")
    void advances() {
        IndexProgress stored = progressAt(41L);
        when(indexProgressRepository.findById(IndexProgress.SINGLETON_ID)).thenReturn(Optional.of(stored));

        tracker.markIndexed(42L);

        verify(indexProgressRepository).save(stored);
        assertThat(stored.getHeight()).isEqualTo(42L);
    }

    @Test
    @DisplayName("progress never moves backwards")
    void rejectsLowerHeight() {
        when(indexProgressRepository.findById(IndexProgress.SINGLETON_ID)).thenReturn(Optional.of(progressAt(42L)));

        assertThatThrownBy(() -> tracker.markIndexed(41L)).isInstanceOf(IllegalStateException.class);
        verify(indexProgressRepository, never()).save(any());
    }
}
