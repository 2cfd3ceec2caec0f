package com.chainindexer.query;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of records, newest id first, with the total count of matching records.
 */
public record ResultPage<T>(List<T> items, long total, int page, int size) {

    public static <S, T> ResultPage<T> of(Page<S> page, Function<S, T> mapper) {
        return new ResultPage<>(
                page.getContent().stream().map(mapper).toList(),
                page.getTotalElements(),
                page.getNumber(),
                page.getSize());
    }

    public static <T> ResultPage<T> of(Page<T> page) {
        return of(page, Function.identity());
    }
}
