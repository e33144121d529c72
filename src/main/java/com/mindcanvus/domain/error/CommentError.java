package com.mindcanvus.domain.error;

import java.util.UUID;

public sealed interface CommentError extends DomainError {

    record PostNotFound(UUID postId) implements CommentError {
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

    record CommentNotFound(UUID commentId) implements CommentError {
        @Override
        public String message() {
            return "Comment not found";
        }

        @Override
        public String code() {
            return "COMMENT_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record ParentNotFound(UUID parentId) implements CommentError {
        @Override
        public String message() {
            return "Parent comment not found";
        }

        @Override
        public String code() {
            return "PARENT_COMMENT_NOT_FOUND";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    record CommentsDisabled(UUID postId) implements CommentError {
        @Override
        public String message() {
            return "Comments are disabled for this post";
        }

        @Override
        public String code() {
            return "COMMENTS_DISABLED";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }
    }

    record NotAuthorized(String action) implements CommentError {
        @Override
        public String message() {
            return "Not authorized to " + action + " this comment";
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

    record ValidationFailed(ValidationError error) implements CommentError {
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
