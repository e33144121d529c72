package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.PostContentError;

public enum Category {
    ENTERTAINMENT("Entertainment"),
    EDUCATION("Education"),
    FUN("Fun"),
    MOVIES("Movies"),
    TECHNOLOGY("Technology"),
    LIFESTYLE("Lifestyle"),
    TRAVEL("Travel"),
    FOOD("Food"),
    SPORTS("Sports"),
    OTHER("Other");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses the display label ("Technology") case-insensitively.
     */
    public static Result<Category, PostContentError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(PostContentError.MissingCategory.INSTANCE);
        }
        for (Category category : values()) {
            if (category.label.equalsIgnoreCase(value.trim())) {
                return Result.success(category);
            }
        }
        return Result.failure(new PostContentError.InvalidCategory(value));
    }

    public static Category fromLabel(String label) {
        for (Category category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new IllegalStateException("Unknown category in store: " + label);
    }
}
