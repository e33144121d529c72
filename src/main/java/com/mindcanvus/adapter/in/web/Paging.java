package com.mindcanvus.adapter.in.web;

import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.infrastructure.config.AppProperties;

final class Paging {

    private Paging() {}

    static PageRequest of(Integer page, Integer limit, AppProperties appProperties) {
        AppProperties.Pagination pagination = appProperties.getPagination();
        return PageRequest.of(page, limit, pagination.getDefaultLimit(), pagination.getMaxLimit());
    }
}
