package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.RelationshipValidationError;

import java.time.Instant;
import java.util.UUID;

/**
 * A proposal from one user to another to become friends.
 * Only pending requests are stored: accepting, rejecting or cancelling consumes the record.
 */
public record FriendRequest(
    UUID id,
    UserId fromUserId,
    UserId toUserId,
    FriendRequestStatus status,
    Instant createdAt
) {
    public static Result<FriendRequest, RelationshipValidationError> create(
            UUID id, UserId fromUserId, UserId toUserId, Instant now) {
        if (fromUserId.equals(toUserId)) {
            return Result.failure(RelationshipValidationError.SelfFriendRequest.INSTANCE);
        }
        return Result.success(new FriendRequest(id, fromUserId, toUserId, FriendRequestStatus.PENDING, now));
    }

    public boolean isPending() {
        return status == FriendRequestStatus.PENDING;
    }
}
