package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.RelationshipValidationError;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FollowTest {

    @Test
    void shouldCreateFollowBetweenDifferentUsers() {
        UserId follower = UserId.random();
        UserId followee = UserId.random();
        Instant now = Instant.now();

        var result = Follow.create(follower, followee, now);

        assertTrue(result.isSuccess());
        assertEquals(follower, result.getOrThrow().followerId());
        assertEquals(followee, result.getOrThrow().followeeId());
        assertEquals(now, result.getOrThrow().createdAt());
    }

    @Test
    void shouldFailWhenFollowingSelf() {
        UserId user = UserId.random();

        var result = Follow.create(user, user, Instant.now());

        assertTrue(result.isFailure());
        assertInstanceOf(RelationshipValidationError.SelfFollow.class, result.errorOrNull());
    }
}
