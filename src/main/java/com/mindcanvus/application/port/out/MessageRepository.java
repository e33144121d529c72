package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.Conversation;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface MessageRepository {
    void save(Message message);

    /**
     * Messages exchanged between the two users in either direction, newest first.
     */
    List<Message> findConversation(UserId userId, UserId otherId, int offset, int limit);
    long countConversation(UserId userId, UserId otherId);

    void markRead(List<UUID> messageIds, Instant readAt);

    /**
     * Marks every unread message from {@code senderId} to {@code recipientId} as read.
     *
     * @return number of messages updated
     */
    int markConversationRead(UserId senderId, UserId recipientId, Instant readAt);

    /**
     * One entry per counterpart, most recent conversation first.
     */
    List<Conversation> findConversations(UserId userId);

    long countUnread(UserId recipientId);
}
