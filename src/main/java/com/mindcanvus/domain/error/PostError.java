package com.mindcanvus.domain.error;

import com.mindcanvus.domain.model.UserId;

import java.util.UUID;

public sealed interface PostError extends DomainError {

    record PostNotFound(UUID postId) implements PostError {
        @Override
        public String message() {
            return "Post not found";
        }

        @Override
        public String code() {
            return "POST_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record NotAuthorized(String action) implements PostError {
        @Override
        public String message() {
            return "Not authorized to " + action + " this post";
        }

        @Override
        public String code() {
            return "FORBIDDEN";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.FORBIDDEN;
        }
    }

    record UnpublishedHidden(UserId authorId) implements PostError {
        @Override
        public String message() {
            return "Only the author can view unpublished posts";
        }

        @Override
        public String code() {
            return "FORBIDDEN";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.FORBIDDEN;
        }
    }

    record ValidationFailed(ValidationError error) implements PostError {
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
