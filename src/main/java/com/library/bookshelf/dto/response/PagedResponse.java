package com.library.bookshelf.dto.response;

import java.util.List;
import java.util.function.Function;

/**
 * One window of a listing. {@code totalCount} counts the whole visible population,
 * independent of {@code offset} and {@code limit}.
 */
public record PagedResponse<T>(
    long totalCount,
    long offset,
    int limit,
    List<T> items
) {

    public <R> PagedResponse<R> map(Function<? super T, ? extends R> mapper) {
        return new PagedResponse<>(totalCount, offset, limit, items.stream().<R>map(mapper).toList());
    }
}
