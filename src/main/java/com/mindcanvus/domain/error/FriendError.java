package com.mindcanvus.domain.error;

import com.mindcanvus.domain.model.UserId;

/**
 * Expected failures of the friend-request lifecycle. Self-requests surface as
 * {@link ValidationFailed} wrapping {@code RelationshipValidationError.SelfFriendRequest}.
 */
public sealed interface FriendError extends DomainError {

    record UserNotFound(UserId userId) implements FriendError {
        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record AlreadyFriends(UserId userId, UserId otherId) implements FriendError {
        @Override
        public String message() {
            return "Already friends with this user";
        }

        @Override
        public String code() {
            return "ALREADY_FRIENDS";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record DuplicateRequest(UserId fromUserId, UserId toUserId) implements FriendError {
        @Override
        public String message() {
            return "Friend request already sent";
        }

        @Override
        public String code() {
            return "DUPLICATE_REQUEST";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record RequestNotFound(UserId fromUserId, UserId toUserId) implements FriendError {
        @Override
        public String message() {
            return "Friend request not found";
        }

        @Override
        public String code() {
            return "FRIEND_REQUEST_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record NotFriends(UserId userId, UserId otherId) implements FriendError {
        @Override
        public String message() {
            return "Not friends with this user";
        }

        @Override
        public String code() {
            return "NOT_FRIENDS";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record ValidationFailed(ValidationError error) implements FriendError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }
    }
}
