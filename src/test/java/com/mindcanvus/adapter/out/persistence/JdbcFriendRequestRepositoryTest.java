package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.domain.model.Follow;
import com.mindcanvus.domain.model.FriendRequest;
import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcFriendRequestRepositoryTest extends FullStackTestBase {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private JdbcFriendRequestRepository friendRequestRepository;

    @Autowired
    private JdbcFriendshipRepository friendshipRepository;

    @Autowired
    private JdbcUserRepository userRepository;

    @Autowired
    private JdbcFollowRepository followRepository;

    private UserId alice;
    private UserId bob;
    private UserId charlie;

    @BeforeEach
    void setUpTestUsers() {
        alice = saveUser("alice", NOW);
        bob = saveUser("bob", NOW.plusSeconds(1));
        charlie = saveUser("charlie", NOW.plusSeconds(2));
    }

    private UserId saveUser(String username, Instant createdAt) {
        User user = User.create(UserId.random(), username, username + "@example.com", null, null, createdAt).getOrThrow();
        userRepository.save(user, "hash");
        return user.id();
    }

    private FriendRequest request(UserId from, UserId to) {
        return FriendRequest.create(UUID.randomUUID(), from, to, NOW).getOrThrow();
    }

    @Test
    void shouldFindPendingRequestInOneDirectionOnly() {
        // When
        friendRequestRepository.save(request(alice, bob));

        // Then
        assertTrue(friendRequestRepository.findPending(alice, bob).isPresent());
        assertTrue(friendRequestRepository.findPending(bob, alice).isEmpty());
    }

    @Test
    void shouldRejectSecondRequestForSamePair() {
        // Given
        friendRequestRepository.save(request(alice, bob));

        // When / Then
        assertThrows(DuplicateKeyException.class, () -> friendRequestRepository.save(request(alice, bob)));
    }

    @Test
    void shouldListIncomingWithSenderAndSent() {
        // Given
        friendRequestRepository.save(request(alice, charlie));
        friendRequestRepository.save(request(bob, charlie));

        // When
        List<IncomingFriendRequest> incoming = friendRequestRepository.findIncoming(charlie, 0, 10);
        List<User> sent = friendRequestRepository.findSentTo(alice, 0, 10);

        // Then
        assertEquals(2, incoming.size());
        assertEquals(2, friendRequestRepository.countIncoming(charlie));
        assertTrue(incoming.stream().anyMatch(r -> r.from().username().equals("alice")));
        assertEquals(List.of(charlie), sent.stream().map(User::id).toList());
        assertEquals(1, friendRequestRepository.countSent(alice));
    }

    @Test
    void deleteByPairShouldAllowResend() {
        // Given
        friendRequestRepository.save(request(alice, bob));

        // When
        int deleted = friendRequestRepository.deleteByPair(alice, bob);

        // Then
        assertEquals(1, deleted);
        assertDoesNotThrow(() -> friendRequestRepository.save(request(alice, bob)));
    }

    @Test
    void friendshipRowsShouldBeDirectional() {
        // When
        friendshipRepository.add(alice, bob, NOW);
        friendshipRepository.add(bob, alice, NOW);
        friendshipRepository.add(alice, bob, NOW);

        // Then
        assertTrue(friendshipRepository.exists(alice, bob));
        assertTrue(friendshipRepository.exists(bob, alice));
        assertEquals(1, friendshipRepository.countFriends(alice));

        friendshipRepository.remove(alice, bob);
        assertFalse(friendshipRepository.exists(alice, bob));
        assertTrue(friendshipRepository.exists(bob, alice));
    }

    @Test
    void suggestionsShouldExcludeSelfAndFriendsNewestFirst() {
        // Given
        UserId dave = saveUser("dave", NOW.plusSeconds(3));
        friendshipRepository.add(alice, bob, NOW);
        friendRequestRepository.save(request(alice, charlie));

        // When
        List<User> suggestions = friendshipRepository.findSuggestions(alice, 0, 10);

        // Then
        assertEquals(List.of(dave, charlie), suggestions.stream().map(User::id).toList());
        assertEquals(2, friendshipRepository.countSuggestions(alice));
    }

    @Test
    void suggestionsJoinedAtTheSameInstantShouldPutMoreFollowedFirst() {
        // Given
        Instant joined = NOW.plusSeconds(10);
        UserId quiet = saveUser("quiet", joined);
        UserId popular = saveUser("popular", joined);
        followRepository.save(Follow.create(bob, popular, NOW).getOrThrow());
        followRepository.save(Follow.create(charlie, popular, NOW).getOrThrow());
        followRepository.save(Follow.create(bob, quiet, NOW).getOrThrow());

        // When
        List<User> suggestions = friendshipRepository.findSuggestions(alice, 0, 2);

        // Then
        assertEquals(List.of(popular, quiet), suggestions.stream().map(User::id).toList());
    }
}
