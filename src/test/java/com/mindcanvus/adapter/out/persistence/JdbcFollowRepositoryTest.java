package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.domain.model.Follow;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcFollowRepositoryTest extends FullStackTestBase {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private JdbcFollowRepository followRepository;

    @Autowired
    private JdbcUserRepository userRepository;

    @Autowired
    private JdbcFriendshipRepository friendshipRepository;

    private UserId alice;
    private UserId bob;
    private UserId charlie;

    @BeforeEach
    void setUpTestUsers() {
        alice = saveUser("alice");
        bob = saveUser("bob");
        charlie = saveUser("charlie");
    }

    private UserId saveUser(String username) {
        User user = User.create(UserId.random(), username, username + "@example.com", null, null, NOW).getOrThrow();
        userRepository.save(user, "hash");
        return user.id();
    }

    private void follow(UserId follower, UserId followee, Instant at) {
        followRepository.save(Follow.create(follower, followee, at).getOrThrow());
    }

    @Test
    void shouldSaveAndCheckFollowRelationship() {
        // When
        follow(alice, bob, NOW);

        // Then
        assertTrue(followRepository.exists(alice, bob));
        assertFalse(followRepository.exists(bob, alice));
    }

    @Test
    void shouldNotCreateDuplicateFollows() {
        // Given
        follow(alice, bob, NOW);

        // When
        follow(alice, bob, NOW.plusSeconds(5));

        // Then
        assertEquals(1, followRepository.count());
    }

    @Test
    void shouldDeleteFollowRelationship() {
        // Given
        follow(alice, bob, NOW);

        // When
        followRepository.delete(alice, bob);

        // Then
        assertFalse(followRepository.exists(alice, bob));
    }

    @Test
    void shouldFindFollowingNewestFirst() {
        // Given
        follow(alice, bob, NOW);
        follow(alice, charlie, NOW.plusSeconds(60));

        // When
        List<FollowRepository.FollowedUser> following = followRepository.findFollowing(alice, 0, 10);

        // Then
        assertEquals(2, following.size());
        assertEquals(charlie, following.get(0).user().id());
        assertEquals(bob, following.get(1).user().id());
        assertEquals(NOW, following.get(1).followedAt());
    }

    @Test
    void shouldFindAndCountFollowers() {
        // Given
        follow(alice, bob, NOW);
        follow(charlie, bob, NOW.plusSeconds(1));

        // When
        List<FollowRepository.FollowedUser> followers = followRepository.findFollowers(bob, 0, 10);

        // Then
        assertEquals(2, followers.size());
        assertEquals(2, followRepository.countFollowers(bob));
        assertEquals(1, followRepository.countFollowing(alice));
    }

    @Test
    void suggestionsShouldExcludeSelfFollowedAndFriends() {
        // Given
        UserId dave = saveUser("dave");
        follow(alice, bob, NOW);
        friendshipRepository.add(alice, charlie, NOW);
        friendshipRepository.add(charlie, alice, NOW);

        // When
        List<User> suggestions = followRepository.findSuggestions(alice, 5);

        // Then
        assertEquals(List.of(dave), suggestions.stream().map(User::id).toList());
    }
}
