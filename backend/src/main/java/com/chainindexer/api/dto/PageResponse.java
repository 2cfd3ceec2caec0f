package com.chainindexer.api.dto;

import com.chainindexer.query.ResultPage;

import java.util.List;
import java.util.function.Function;

/**
 * Offset-paginated response: items newest first, total matching records, echoed page and effective size.
 */
public record PageResponse<T>(List<T> items, long total, int page, int size) {

    public static <S, T> PageResponse<T> from(ResultPage<S> page, Function<S, T> mapper) {
        return new PageResponse<>(page.items().stream().map(mapper).toList(), page.total(), page.page(), page.size());
    }
}
