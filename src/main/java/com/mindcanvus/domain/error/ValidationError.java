package com.mindcanvus.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError extends DomainError {

    @Override
    default ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a valid UUID format: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    // Registration errors
    sealed interface AccountError extends ValidationError {

        record InvalidUsername(String value) implements AccountError {
            @Override
            public String message() {
                return "Username must be 3-30 characters of letters, digits or underscores";
            }

            @Override
            public String code() {
                return "USERNAME_INVALID";
            }
        }

        record InvalidEmail(String value) implements AccountError {
            @Override
            public String message() {
                return "Email address is not valid: " + value;
            }

            @Override
            public String code() {
                return "EMAIL_INVALID";
            }
        }

        record PasswordTooShort(int minLength) implements AccountError {
            @Override
            public String message() {
                return "Password must be at least " + minLength + " characters";
            }

            @Override
            public String code() {
                return "PASSWORD_TOO_SHORT";
            }
        }
    }

    // Post validation errors
    sealed interface PostContentError extends ValidationError {

        record EmptyTitle() implements PostContentError {
            public static final EmptyTitle INSTANCE = new EmptyTitle();
            @Override
            public String message() {
                return "Title is required";
            }

            @Override
            public String code() {
                return "POST_TITLE_EMPTY";
            }
        }

        record TitleTooLong(int length, int maxLength) implements PostContentError {
            @Override
            public String message() {
                return "Title cannot exceed " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_TITLE_TOO_LONG";
            }
        }

        record EmptyContent() implements PostContentError {
            public static final EmptyContent INSTANCE = new EmptyContent();
            @Override
            public String message() {
                return "Content is required";
            }

            @Override
            public String code() {
                return "POST_CONTENT_EMPTY";
            }
        }

        record ContentTooLong(int length, int maxLength) implements PostContentError {
            @Override
            public String message() {
                return "Content cannot exceed " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_CONTENT_TOO_LONG";
            }
        }

        record ExcerptTooLong(int length, int maxLength) implements PostContentError {
            @Override
            public String message() {
                return "Excerpt cannot exceed " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_EXCERPT_TOO_LONG";
            }
        }

        record MissingCategory() implements PostContentError {
            public static final MissingCategory INSTANCE = new MissingCategory();
            @Override
            public String message() {
                return "Category is required";
            }

            @Override
            public String code() {
                return "POST_CATEGORY_MISSING";
            }
        }

        record InvalidCategory(String value) implements PostContentError {
            @Override
            public String message() {
                return "Invalid category: " + value;
            }

            @Override
            public String code() {
                return "POST_CATEGORY_INVALID";
            }
        }

        record InvalidStatus(String value) implements PostContentError {
            @Override
            public String message() {
                return "Invalid status: " + value;
            }

            @Override
            public String code() {
                return "POST_STATUS_INVALID";
            }
        }

        record MissingSchedule() implements PostContentError {
            public static final MissingSchedule INSTANCE = new MissingSchedule();
            @Override
            public String message() {
                return "Scheduled date is required for scheduled posts";
            }

            @Override
            public String code() {
                return "POST_SCHEDULE_MISSING";
            }
        }
    }

    record InvalidSearchPattern(String pattern) implements ValidationError {
        @Override
        public String message() {
            return "Search is not a valid pattern: " + pattern;
        }

        @Override
        public String code() {
            return "SEARCH_PATTERN_INVALID";
        }
    }

    // Comment validation errors
    sealed interface CommentContentError extends ValidationError {

        record EmptyContent() implements CommentContentError {
            public static final EmptyContent INSTANCE = new EmptyContent();
            @Override
            public String message() {
                return "Comment content is required";
            }

            @Override
            public String code() {
                return "COMMENT_CONTENT_EMPTY";
            }
        }

        record ContentTooLong(int length, int maxLength) implements CommentContentError {
            @Override
            public String message() {
                return "Comment cannot exceed " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "COMMENT_CONTENT_TOO_LONG";
            }
        }

        record NestedReply() implements CommentContentError {
            public static final NestedReply INSTANCE = new NestedReply();
            @Override
            public String message() {
                return "Replies can only be added to top-level comments";
            }

            @Override
            public String code() {
                return "COMMENT_NESTED_REPLY";
            }
        }

        record ParentOnOtherPost() implements CommentContentError {
            public static final ParentOnOtherPost INSTANCE = new ParentOnOtherPost();
            @Override
            public String message() {
                return "Parent comment belongs to a different post";
            }

            @Override
            public String code() {
                return "COMMENT_PARENT_MISMATCH";
            }
        }
    }

    // Message validation errors
    sealed interface MessageContentError extends ValidationError {

        record EmptyContent() implements MessageContentError {
            public static final EmptyContent INSTANCE = new EmptyContent();
            @Override
            public String message() {
                return "Message content is required";
            }

            @Override
            public String code() {
                return "MESSAGE_CONTENT_EMPTY";
            }
        }

        record ContentTooLong(int length, int maxLength) implements MessageContentError {
            @Override
            public String message() {
                return "Message cannot exceed " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "MESSAGE_CONTENT_TOO_LONG";
            }
        }
    }

    // Follow and friend request validation errors
    sealed interface RelationshipValidationError extends ValidationError {

        record SelfFollow() implements RelationshipValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();
            @Override
            public String message() {
                return "Cannot follow yourself";
            }

            @Override
            public String code() {
                return "SELF_FOLLOW";
            }
        }

        record SelfFriendRequest() implements RelationshipValidationError {
            public static final SelfFriendRequest INSTANCE = new SelfFriendRequest();
            @Override
            public String message() {
                return "You cannot send friend request to yourself";
            }

            @Override
            public String code() {
                return "INVALID_TARGET";
            }
        }
    }
}
