package com.mindcanvus.domain.error;

import com.mindcanvus.domain.model.UserId;

/**
 * Sealed type representing expected business errors for follow operations at the application layer.
 * These errors are determined by querying state (repository), not by domain validation.
 *
 * For domain validation errors (like self-follow), see ValidationError.RelationshipValidationError.
 */
public sealed interface FollowError extends DomainError {

    record UserNotFound(UserId userId) implements FollowError {
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

    record AlreadyFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is already following " + followeeId;
        }

        @Override
        public String code() {
            return "ALREADY_FOLLOWING";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record NotFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is not following " + followeeId;
        }

        @Override
        public String code() {
            return "NOT_FOLLOWING";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    /**
     * Wraps a domain validation error that occurred during follow creation.
     */
    record ValidationFailed(ValidationError error) implements FollowError {
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
