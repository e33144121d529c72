package com.mindcanvus.domain.model;

/**
 * 1-based page number and page size.
 */
public record PageRequest(int page, int limit) {

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }

    /**
     * Builds a request from optional query parameters, clamping out-of-range values.
     */
    public static PageRequest of(Integer page, Integer limit, int defaultLimit, int maxLimit) {
        int effectivePage = page == null || page < 1 ? 1 : page;
        int effectiveLimit = limit == null || limit < 1 ? defaultLimit : Math.min(limit, maxLimit);
        return new PageRequest(effectivePage, effectiveLimit);
    }

    /**
     * Row offset of this page, saturated at {@link Integer#MAX_VALUE} so an absurd page number reads as past the end.
     */
    public int offset() {
        return (int) Math.min((long) (page - 1) * limit, Integer.MAX_VALUE);
    }
}
