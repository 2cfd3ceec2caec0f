package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Singleton row holding the last fully indexed height. Written only after that height's events and votes
 * are stored; read once at startup to pick the resume point.
 */
@Document(collection = "index_progress")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexProgress {

    public static final long SINGLETON_ID = 1L;

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private long height;
    private Instant updatedAt;

    public static IndexProgress initial() {
        IndexProgress progress = new IndexProgress();
        progress.setId(SINGLETON_ID);
        progress.setHeight(0L);
        return progress;
    }
}
