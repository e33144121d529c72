package com.mindcanvus.domain.model;

public enum CommentSort {
    NEWEST,
    OLDEST;

    public static CommentSort fromParam(String value) {
        return value != null && value.trim().equalsIgnoreCase("oldest") ? OLDEST : NEWEST;
    }
}
