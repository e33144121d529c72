package com.mindcanvus.domain.model;

import java.util.List;

/**
 * One page of an offset-paginated listing.
 */
public record Page<T>(
    List<T> data,
    int page,
    int limit,
    long total
) {
    public static <T> Page<T> of(List<T> data, PageRequest request, long total) {
        return new Page<>(List.copyOf(data), request.page(), request.limit(), total);
    }

    public long pages() {
        return limit == 0 ? 0 : (total + limit - 1) / limit;
    }

    public boolean hasNext() {
        return (long) page * limit < total;
    }

    public boolean hasPrev() {
        return page > 1;
    }
}
