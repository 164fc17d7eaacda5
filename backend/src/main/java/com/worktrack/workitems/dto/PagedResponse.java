package com.worktrack.workitems.dto;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results plus the metadata a client needs to walk the rest.
 * {@code page} is 1-indexed.
 */
public record PagedResponse<T>(
    List<T> items,
    long totalCount,
    int page,
    int pageSize,
    int totalPages,
    boolean hasNextPage,
    boolean hasPreviousPage
) {

    public static <T> PagedResponse<T> of(List<T> items, long totalCount, int page, int pageSize) {
        int totalPages = (int) ((totalCount + pageSize - 1) / pageSize);
        return new PagedResponse<>(
            List.copyOf(items),
            totalCount,
            page,
            pageSize,
            totalPages,
            page < totalPages,
            page > 1
        );
    }

    public <R> PagedResponse<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResponse<>(mapped, totalCount, page, pageSize, totalPages, hasNextPage, hasPreviousPage);
    }
}
