package com.mindcanvus.application.service;

import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Role;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FollowService.
 * Tests service logic with mocked dependencies.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FollowService")
class FollowServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private FollowRepository followRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private MetricsPort metrics;

    private FollowService followService;

    @BeforeEach
    void setUp() {
        followService = new FollowService(followRepository, userRepository, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("followUser")
    class FollowUserTests {

        @Test
        @DisplayName("Should create follow relationship")
        void shouldCreateFollowRelationship() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(userRepository.exists(followee)).thenReturn(true);
            when(followRepository.exists(follower, followee)).thenReturn(false);

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertTrue(result.isSuccess());
            verify(followRepository).save(argThat(f -> f.followerId().equals(follower) && NOW.equals(f.createdAt())));
            verify(metrics).incrementFollows();
        }

        @Test
        @DisplayName("Should fail when following self")
        void shouldFailWhenFollowingSelf() {
            // Given
            UserId user = UserId.random();

            // When
            var result = followService.followUser(user, user);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.ValidationFailed.class, result.errorOrNull());
            verifyNoInteractions(followRepository);
        }

        @Test
        @DisplayName("Should fail when followee does not exist")
        void shouldFailWhenFolloweeMissing() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();
            when(userRepository.exists(followee)).thenReturn(false);

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertInstanceOf(FollowError.UserNotFound.class, result.errorOrNull());
            verifyNoInteractions(followRepository);
        }

        @Test
        @DisplayName("Should fail when already following")
        void shouldFailWhenAlreadyFollowing() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(userRepository.exists(followee)).thenReturn(true);
            when(followRepository.exists(follower, followee)).thenReturn(true);

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.AlreadyFollowing.class, result.errorOrNull());
            verify(followRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("unfollow")
    class UnfollowTests {

        @Test
        @DisplayName("Should delete follow relationship")
        void shouldDeleteFollowRelationship() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(userRepository.exists(followee)).thenReturn(true);
            when(followRepository.exists(follower, followee)).thenReturn(true);

            // When
            var result = followService.unfollow(follower, followee);

            // Then
            assertTrue(result.isSuccess());
            verify(followRepository).delete(follower, followee);
            verify(metrics).incrementUnfollows();
        }

        @Test
        @DisplayName("Should fail when not following")
        void shouldFailWhenNotFollowing() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(userRepository.exists(followee)).thenReturn(true);
            when(followRepository.exists(follower, followee)).thenReturn(false);

            // When
            var result = followService.unfollow(follower, followee);

            // Then
            assertInstanceOf(FollowError.NotFollowing.class, result.errorOrNull());
            verify(followRepository, never()).delete(any(), any());
        }
    }

    @Test
    @DisplayName("getFollowers should unwrap users and count the total")
    void getFollowersShouldBuildPage() {
        // Given
        UserId userId = UserId.random();
        User follower = new User(UserId.random(), "fan", "fan@example.com", null, null, null, null, Role.USER, NOW);
        when(followRepository.findFollowers(userId, 0, 10))
            .thenReturn(List.of(new FollowRepository.FollowedUser(follower, NOW)));
        when(followRepository.countFollowers(userId)).thenReturn(1L);

        // When
        var page = followService.getFollowers(userId, new PageRequest(1, 10));

        // Then
        assertEquals(List.of(follower), page.data());
        assertEquals(1, page.total());
        assertFalse(page.hasNext());
    }
}
