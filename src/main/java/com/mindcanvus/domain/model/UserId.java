package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.UserIdError;

import java.util.UUID;

/**
 * Value Object for account identity.
 */
public record UserId(UUID value) {

    public UserId {
        if (value == null) {
            throw new IllegalStateException("UserId value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses external input (path variables, token subjects) into a UserId.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        try {
            return Result.success(new UserId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
    }

    public static UserId of(UUID value) {
        return new UserId(value);
    }

    /**
     * Creates a UserId from a value that originated in our own store.
     *
     * @throws IllegalStateException if the value is not a valid UUID (indicates data corruption)
     */
    public static UserId fromTrusted(String value) {
        try {
            return new UserId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Corrupted UserId in trusted source: " + value, e);
        }
    }

    public static UserId random() {
        return new UserId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
