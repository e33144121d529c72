package com.mindcanvus.domain.error;

import com.mindcanvus.domain.model.UserId;

public sealed interface MessageError extends DomainError {

    record UserNotFound(UserId userId) implements MessageError {
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

    record NotFriends(UserId senderId, UserId recipientId) implements MessageError {
        @Override
        public String message() {
            return "You can only message your friends";
        }

        @Override
        public String code() {
            return "NOT_FRIENDS";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.FORBIDDEN;
        }
    }

    record ValidationFailed(ValidationError error) implements MessageError {
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
