package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.RelationshipValidationError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FriendRequestTest {

    @Test
    void shouldCreatePendingRequest() {
        UserId from = UserId.random();
        UserId to = UserId.random();

        var result = FriendRequest.create(UUID.randomUUID(), from, to, Instant.now());

        assertTrue(result.isSuccess());
        assertTrue(result.getOrThrow().isPending());
        assertEquals(from, result.getOrThrow().fromUserId());
        assertEquals(to, result.getOrThrow().toUserId());
    }

    @Test
    void shouldRejectRequestToSelf() {
        UserId user = UserId.random();

        var result = FriendRequest.create(UUID.randomUUID(), user, user, Instant.now());

        assertTrue(result.isFailure());
        assertInstanceOf(RelationshipValidationError.SelfFriendRequest.class, result.errorOrNull());
    }
}
