package com.mindcanvus.domain.model;

public enum PostSort {
    LATEST,
    OLDEST,
    /** Likes descending, then views descending. */
    POPULAR,
    VIEWS;

    /**
     * Unknown or missing values fall back to {@link #LATEST}.
     */
    public static PostSort fromParam(String value) {
        if (value == null) {
            return LATEST;
        }
        return switch (value.trim().toLowerCase()) {
            case "oldest" -> OLDEST;
            case "popular" -> POPULAR;
            case "views" -> VIEWS;
            default -> LATEST;
        };
    }
}
