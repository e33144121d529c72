package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.CommentContentError;

import java.time.Instant;
import java.util.UUID;

/**
 * A comment on a post, or a reply to a top-level comment. Replies never nest further.
 */
public record Comment(
    UUID id,
    UUID postId,
    UserId authorId,
    String content,
    UUID parentId,
    boolean isEdited,
    Instant editedAt,
    boolean isDeleted,
    Instant createdAt,
    Instant updatedAt
) {
    public static final int MAX_CONTENT_LENGTH = 1000;
    public static final String DELETED_PLACEHOLDER = "[Comment deleted]";

    public static Result<Comment, CommentContentError> create(
            UUID id, UUID postId, UserId authorId, String content, Comment parent, Instant now) {
        var contentResult = validateContent(content);
        if (contentResult.isFailure()) {
            return Result.failure(contentResult.errorOrNull());
        }
        if (parent != null) {
            if (!parent.postId().equals(postId)) {
                return Result.failure(CommentContentError.ParentOnOtherPost.INSTANCE);
            }
            if (parent.isReply()) {
                return Result.failure(CommentContentError.NestedReply.INSTANCE);
            }
        }
        return Result.success(new Comment(
            id, postId, authorId, contentResult.getOrThrow(),
            parent != null ? parent.id() : null,
            false, null, false, now, now
        ));
    }

    public Result<Comment, CommentContentError> edit(String newContent, Instant now) {
        return validateContent(newContent).map(valid ->
            new Comment(id, postId, authorId, valid, parentId, true, now, isDeleted, createdAt, now));
    }

    /**
     * Soft delete: the row stays so replies keep their parent, the text is replaced.
     */
    public Comment softDelete(Instant now) {
        return new Comment(id, postId, authorId, DELETED_PLACEHOLDER, parentId, isEdited, editedAt, true, createdAt, now);
    }

    public boolean isReply() {
        return parentId != null;
    }

    private static Result<String, CommentContentError> validateContent(String content) {
        if (content == null || content.isBlank()) {
            return Result.failure(CommentContentError.EmptyContent.INSTANCE);
        }
        String trimmed = content.trim();
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            return Result.failure(new CommentContentError.ContentTooLong(trimmed.length(), MAX_CONTENT_LENGTH));
        }
        return Result.success(trimmed);
    }
}
