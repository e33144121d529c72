package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.MessageContentError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    private static final UserId SENDER = UserId.random();
    private static final UserId RECIPIENT = UserId.random();
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldCreateUnreadMessage() {
        Message message = Message.create(UUID.randomUUID(), SENDER, RECIPIENT, " hi ", NOW).getOrThrow();

        assertEquals("hi", message.content());
        assertFalse(message.read());
        assertNull(message.readAt());
        assertTrue(message.isUnreadFor(RECIPIENT));
        assertFalse(message.isUnreadFor(SENDER));
    }

    @Test
    void shouldFailWithEmptyContent() {
        var result = Message.create(UUID.randomUUID(), SENDER, RECIPIENT, "", NOW);
        assertInstanceOf(MessageContentError.EmptyContent.class, result.errorOrNull());
    }

    @Test
    void shouldFailWithContentExceeding2000Characters() {
        var result = Message.create(UUID.randomUUID(), SENDER, RECIPIENT, "m".repeat(2001), NOW);
        assertInstanceOf(MessageContentError.ContentTooLong.class, result.errorOrNull());
    }

    @Test
    void markReadShouldStampReadAtOnce() {
        Message message = Message.create(UUID.randomUUID(), SENDER, RECIPIENT, "hi", NOW).getOrThrow();
        Instant first = NOW.plusSeconds(10);

        Message read = message.markRead(first);

        assertTrue(read.read());
        assertEquals(first, read.readAt());
        assertSame(read, read.markRead(first.plusSeconds(10)));
    }
}
