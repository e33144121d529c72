package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.PostContentError;

public enum PostStatus {
    DRAFT("draft"),
    PUBLISHED("published"),
    SCHEDULED("scheduled");

    private final String value;

    PostStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Result<PostStatus, PostContentError> parse(String value) {
        for (PostStatus status : values()) {
            if (status.value.equalsIgnoreCase(value == null ? "" : value.trim())) {
                return Result.success(status);
            }
        }
        return Result.failure(new PostContentError.InvalidStatus(value));
    }

    public static PostStatus fromValue(String value) {
        for (PostStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalStateException("Unknown post status in store: " + value);
    }
}
