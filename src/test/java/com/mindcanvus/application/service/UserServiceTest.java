package com.mindcanvus.application.service;

import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.application.port.out.FriendshipRepository;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.application.port.out.SearchPatternRejectedException;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Role;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private FollowRepository followRepository;

    @Mock
    private FriendshipRepository friendshipRepository;

    @Mock
    private PostRepository postRepository;

    private UserService userService;

    private final User user = new User(UserId.random(), "alice", "alice@example.com", null, null, null, null, Role.USER, Instant.now());

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, followRepository, friendshipRepository, postRepository);
    }

    @Test
    @DisplayName("getProfile should gather the counters")
    void getProfileShouldGatherCounters() {
        // Given
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(user));
        when(followRepository.countFollowers(user.id())).thenReturn(4L);
        when(followRepository.countFollowing(user.id())).thenReturn(2L);
        when(friendshipRepository.countFriends(user.id())).thenReturn(1L);
        when(postRepository.countPublishedByAuthor(user.id())).thenReturn(7L);

        // When
        var profile = userService.getProfile("alice").orElseThrow();

        // Then
        assertEquals(4, profile.followersCount());
        assertEquals(2, profile.followingCount());
        assertEquals(1, profile.friendsCount());
        assertEquals(7, profile.postsCount());
    }

    @Test
    @DisplayName("getProfile should be empty for an unknown username")
    void getProfileShouldBeEmptyForUnknown() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertTrue(userService.getProfile("ghost").isEmpty());
        verifyNoInteractions(followRepository, friendshipRepository, postRepository);
    }

    @Test
    @DisplayName("searchUsers should require a query")
    void searchUsersShouldRequireQuery() {
        var result = userService.searchUsers("  ", new PageRequest(1, 10));

        assertInstanceOf(ValidationError.InvalidSearchPattern.class, result.errorOrNull());
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("searchUsers should reject an invalid regex")
    void searchUsersShouldRejectInvalidRegex() {
        var result = userService.searchUsers("[a-", new PageRequest(1, 10));

        assertInstanceOf(ValidationError.InvalidSearchPattern.class, result.errorOrNull());
    }

    @Test
    @DisplayName("searchUsers should page the matches")
    void searchUsersShouldPage() {
        // Given
        when(userRepository.search("^ali", 0, 10)).thenReturn(List.of(user));
        when(userRepository.countSearch("^ali")).thenReturn(1L);

        // When
        var page = userService.searchUsers("^ali", new PageRequest(1, 10)).getOrThrow();

        // Then
        assertEquals(List.of(user), page.data());
    }

    @Test
    @DisplayName("searchUsers should report a pattern the database refuses as invalid")
    void searchUsersShouldRejectPatternRefusedByDatabase() {
        // Given
        when(userRepository.search("(?<n>a)", 0, 10))
            .thenThrow(new SearchPatternRejectedException("(?<n>a)", new RuntimeException("invalid regular expression")));

        // When
        var result = userService.searchUsers("(?<n>a)", new PageRequest(1, 10));

        // Then
        assertInstanceOf(ValidationError.InvalidSearchPattern.class, result.errorOrNull());
        verify(userRepository, never()).countSearch(any());
    }
}
