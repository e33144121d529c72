package com.mindcanvus.adapter.in.web;

import com.mindcanvus.domain.model.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(
    List<T> data,
    Pagination pagination
) {
    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        List<T> data = page.data().stream().map(mapper).toList();
        Pagination pagination = new Pagination(page.page(), page.pages(), page.total(), page.hasNext(), page.hasPrev());
        return new PageResponse<>(data, pagination);
    }

    public record Pagination(
        int current,
        long pages,
        long total,
        boolean hasNext,
        boolean hasPrev
    ) {}
}
