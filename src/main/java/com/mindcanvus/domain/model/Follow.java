package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.RelationshipValidationError;

import java.time.Instant;

public record Follow(
    UserId followerId,
    UserId followeeId,
    Instant createdAt
) {
    /**
     * Creates a Follow relationship, returning a Result for expected validation failures.
     */
    public static Result<Follow, RelationshipValidationError> create(UserId followerId, UserId followeeId, Instant now) {
        if (followerId.equals(followeeId)) {
            return Result.failure(RelationshipValidationError.SelfFollow.INSTANCE);
        }
        return Result.success(new Follow(followerId, followeeId, now));
    }
}
