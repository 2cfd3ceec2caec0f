package com.chainindexer.query;

import com.chainindexer.query.config.QueryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Builds id-descending page requests from raw API parameters. Size is clamped to 1..maxPageSize; a negative page
 * index is rejected.
 */
@Component
@RequiredArgsConstructor
public class PageRequests {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "id");

    private final QueryProperties queryProperties;

    public Pageable newestFirst(Integer page, Integer size) {
        int index = page == null ? 0 : page;
        if (index < 0) {
            throw new InvalidPageException(index);
        }
        int requested = size == null ? queryProperties.getDefaultPageSize() : size;
        int clamped = Math.max(1, Math.min(requested, queryProperties.getMaxPageSize()));
        return PageRequest.of(index, clamped, NEWEST_FIRST);
    }
}
