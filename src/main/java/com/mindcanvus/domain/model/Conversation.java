package com.mindcanvus.domain.model;

/**
 * One entry of a user's inbox: the other party, the latest message exchanged
 * in either direction, and how many messages from them are still unread.
 */
public record Conversation(User counterpart, Message lastMessage, long unreadCount) {}
