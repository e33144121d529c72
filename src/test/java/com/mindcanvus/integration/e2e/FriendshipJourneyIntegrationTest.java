package com.mindcanvus.integration.e2e;

import com.mindcanvus.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end journeys through the social graph: friend requests, friendship and direct messages.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@EnabledIf("isDockerAvailable")
@DisplayName("Friendship Journey E2E Tests")
@SuppressWarnings({"unchecked", "rawtypes"})
class FriendshipJourneyIntegrationTest extends FullStackTestBase {

    @Autowired
    private TestRestTemplate restTemplate;

    private Account alice;
    private Account bob;

    private record Account(String id, String token) {}

    @BeforeEach
    void registerUsers() {
        alice = register("alice");
        bob = register("bob");
    }

    private Account register(String username) {
        Map<String, Object> body = Map.of(
            "username", username,
            "email", username + "@example.com",
            "password", "secret123"
        );
        ResponseEntity<Map> response = restTemplate.postForEntity("/api/auth/register", body, Map.class);
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        Map<String, Object> user = (Map<String, Object>) response.getBody().get("user");
        return new Account((String) user.get("id"), (String) response.getBody().get("token"));
    }

    private ResponseEntity<Map> call(HttpMethod method, String path, Account as, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(as.token());
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), Map.class);
    }

    private List<Map<String, Object>> data(ResponseEntity<Map> response) {
        return (List<Map<String, Object>>) response.getBody().get("data");
    }

    @Test
    @DisplayName("Request, accept, chat and unfriend")
    void completeFriendshipJourney() {
        // === Step 1: Alice sends a request ===
        ResponseEntity<Map> sent = call(HttpMethod.POST, "/api/friends/request/" + bob.id(), alice, null);
        assertEquals(HttpStatus.CREATED, sent.getStatusCode());

        // === Step 2: A duplicate is refused ===
        ResponseEntity<Map> duplicate = call(HttpMethod.POST, "/api/friends/request/" + bob.id(), alice, null);
        assertEquals(HttpStatus.BAD_REQUEST, duplicate.getStatusCode());

        // === Step 3: Bob sees it and Alice sees it as sent ===
        List<Map<String, Object>> incoming = data(call(HttpMethod.GET, "/api/friends/requests", bob, null));
        assertEquals(1, incoming.size());
        assertEquals("alice", ((Map<String, Object>) incoming.get(0).get("from")).get("username"));
        assertEquals(1, data(call(HttpMethod.GET, "/api/friends/requests/sent", alice, null)).size());

        // === Step 4: Messaging is refused before friendship ===
        ResponseEntity<Map> early = call(HttpMethod.POST, "/api/messages/" + bob.id(), alice, Map.of("content", "hi"));
        assertEquals(HttpStatus.FORBIDDEN, early.getStatusCode());

        // === Step 5: Bob accepts ===
        ResponseEntity<Map> accepted = call(HttpMethod.PUT, "/api/friends/accept/" + alice.id(), bob, null);
        assertEquals(HttpStatus.OK, accepted.getStatusCode());
        assertEquals(1, data(call(HttpMethod.GET, "/api/friends", alice, null)).size());
        assertEquals(1, data(call(HttpMethod.GET, "/api/friends", bob, null)).size());
        assertTrue(data(call(HttpMethod.GET, "/api/friends/requests", bob, null)).isEmpty());

        // === Step 6: They chat ===
        ResponseEntity<Map> message = call(HttpMethod.POST, "/api/messages/" + bob.id(), alice, Map.of("content", "  hi bob  "));
        assertEquals(HttpStatus.CREATED, message.getStatusCode());
        assertEquals("hi bob", message.getBody().get("content"));
        assertEquals(1, ((Number) call(HttpMethod.GET, "/api/messages/unread/count", bob, null).getBody().get("count")).intValue());

        // === Step 7: Bob opens the conversation, which marks it read ===
        List<Map<String, Object>> conversation = data(call(HttpMethod.GET, "/api/messages/" + alice.id(), bob, null));
        assertEquals(1, conversation.size());
        assertEquals(0, ((Number) call(HttpMethod.GET, "/api/messages/unread/count", bob, null).getBody().get("count")).intValue());

        // === Step 8: Alice removes the friendship on both sides ===
        ResponseEntity<Map> removed = call(HttpMethod.DELETE, "/api/friends/" + bob.id(), alice, null);
        assertEquals(HttpStatus.OK, removed.getStatusCode());
        assertTrue(data(call(HttpMethod.GET, "/api/friends", bob, null)).isEmpty());

        ResponseEntity<Map> again = call(HttpMethod.DELETE, "/api/friends/" + bob.id(), alice, null);
        assertEquals(HttpStatus.BAD_REQUEST, again.getStatusCode());
        assertEquals("NOT_FRIENDS", again.getBody().get("error"));
    }

    @Test
    @DisplayName("A rejected request can be sent again")
    void rejectedRequestCanBeResent() {
        // Given
        call(HttpMethod.POST, "/api/friends/request/" + bob.id(), alice, null);

        // When
        ResponseEntity<Map> rejected = call(HttpMethod.PUT, "/api/friends/reject/" + alice.id(), bob, null);

        // Then
        assertEquals(HttpStatus.OK, rejected.getStatusCode());
        ResponseEntity<Map> resent = call(HttpMethod.POST, "/api/friends/request/" + bob.id(), alice, null);
        assertEquals(HttpStatus.CREATED, resent.getStatusCode());
    }

    @Test
    @DisplayName("Following is one-way and shows up on the profile")
    void followShowsOnProfile() {
        // When
        ResponseEntity<Map> followed = call(HttpMethod.POST, "/api/users/" + bob.id() + "/follow", alice, null);

        // Then
        assertEquals(HttpStatus.CREATED, followed.getStatusCode());
        ResponseEntity<Map> profile = restTemplate.getForEntity("/api/users/bob", Map.class);
        assertEquals(HttpStatus.OK, profile.getStatusCode());
        assertEquals(1, ((Number) profile.getBody().get("followersCount")).intValue());
        assertEquals(0, ((Number) profile.getBody().get("followingCount")).intValue());
    }
}
