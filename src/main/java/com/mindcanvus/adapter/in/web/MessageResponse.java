package com.mindcanvus.adapter.in.web;

import com.mindcanvus.domain.model.Message;

import java.time.Instant;
import java.util.UUID;

public record MessageResponse(
    UUID id,
    String senderId,
    String recipientId,
    String content,
    boolean read,
    Instant readAt,
    Instant createdAt
) {
    public static MessageResponse from(Message message) {
        return new MessageResponse(
            message.id(),
            message.senderId().toString(),
            message.recipientId().toString(),
            message.content(),
            message.read(),
            message.readAt(),
            message.createdAt()
        );
    }
}
