package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.MessageContentError;

import java.time.Instant;
import java.util.UUID;

public record Message(
    UUID id,
    UserId senderId,
    UserId recipientId,
    String content,
    boolean read,
    Instant readAt,
    Instant createdAt
) {
    public static final int MAX_CONTENT_LENGTH = 2000;

    /**
     * Creates an unread message. Content is trimmed and must not be blank.
     */
    public static Result<Message, MessageContentError> create(
            UUID id, UserId senderId, UserId recipientId, String content, Instant now) {
        if (content == null || content.isBlank()) {
            return Result.failure(MessageContentError.EmptyContent.INSTANCE);
        }
        String trimmed = content.trim();
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            return Result.failure(new MessageContentError.ContentTooLong(trimmed.length(), MAX_CONTENT_LENGTH));
        }
        return Result.success(new Message(id, senderId, recipientId, trimmed, false, null, now));
    }

    public boolean isUnreadFor(UserId userId) {
        return !read && recipientId.equals(userId);
    }

    public Message markRead(Instant now) {
        return read ? this : new Message(id, senderId, recipientId, content, true, now, createdAt);
    }
}
