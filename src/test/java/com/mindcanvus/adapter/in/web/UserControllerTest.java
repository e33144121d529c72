package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.FollowUserUseCase;
import com.mindcanvus.application.port.in.GetFollowSuggestionsUseCase;
import com.mindcanvus.application.port.in.GetFollowersUseCase;
import com.mindcanvus.application.port.in.GetFollowingUseCase;
import com.mindcanvus.application.port.in.GetUserProfileUseCase;
import com.mindcanvus.application.port.in.SearchUsersUseCase;
import com.mindcanvus.application.port.in.UnfollowUserUseCase;
import com.mindcanvus.application.port.out.TokenService;
import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.Role;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.domain.model.UserProfile;
import com.mindcanvus.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(UserController.class)
class UserControllerTest {

    private static final String TOKEN = "valid-token";
    private static final String BOB = "660e8400-e29b-41d4-a716-446655440001";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetUserProfileUseCase getUserProfileUseCase;

    @MockBean
    private SearchUsersUseCase searchUsersUseCase;

    @MockBean
    private GetFollowSuggestionsUseCase getFollowSuggestionsUseCase;

    @MockBean
    private FollowUserUseCase followUserUseCase;

    @MockBean
    private UnfollowUserUseCase unfollowUserUseCase;

    @MockBean
    private GetFollowersUseCase getFollowersUseCase;

    @MockBean
    private GetFollowingUseCase getFollowingUseCase;

    @MockBean
    private TokenService tokenService;

    @MockBean
    private AppProperties appProperties;

    private final UserId alice = UserId.random();
    private final UserId bob = UserId.parse(BOB).getOrThrow();

    @BeforeEach
    void setUp() {
        when(appProperties.getPagination()).thenReturn(new AppProperties.Pagination());
        when(tokenService.verify(TOKEN)).thenReturn(Optional.of(Actor.user(alice)));
    }

    private User user(UserId id, String username) {
        return new User(id, username, username + "@example.com", "First", "Last", null, null, Role.USER, NOW);
    }

    @Test
    void shouldReturnProfileWithCounters() throws Exception {
        when(getUserProfileUseCase.getProfile("bob"))
            .thenReturn(Optional.of(new UserProfile(user(bob, "bob"), 3, 2, 1, 4)));

        mockMvc.perform(get("/api/users/bob"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user.username").value("bob"))
            .andExpect(jsonPath("$.user.email").doesNotExist())
            .andExpect(jsonPath("$.followersCount").value(3))
            .andExpect(jsonPath("$.followingCount").value(2))
            .andExpect(jsonPath("$.friendsCount").value(1))
            .andExpect(jsonPath("$.postsCount").value(4));
    }

    @Test
    void shouldReturn404ForUnknownUsername() throws Exception {
        when(getUserProfileUseCase.getProfile("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/users/ghost"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("USER_NOT_FOUND"));
    }

    @Test
    void shouldSearchUsers() throws Exception {
        when(searchUsersUseCase.searchUsers(eq("^bo"), any(PageRequest.class)))
            .thenReturn(Result.success(Page.of(List.of(user(bob, "bob")), new PageRequest(1, 10), 1)));

        mockMvc.perform(get("/api/users/search").param("q", "^bo"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].username").value("bob"))
            .andExpect(jsonPath("$.pagination.hasNext").value(false));
    }

    @Test
    void shouldRejectInvalidSearchPattern() throws Exception {
        when(searchUsersUseCase.searchUsers(eq("[bo"), any(PageRequest.class)))
            .thenReturn(Result.failure(new ValidationError.InvalidSearchPattern("[bo")));

        mockMvc.perform(get("/api/users/search").param("q", "[bo"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("SEARCH_PATTERN_INVALID"));
    }

    @Test
    void suggestionsShouldDefaultToFive() throws Exception {
        when(getFollowSuggestionsUseCase.getFollowSuggestions(alice, 5)).thenReturn(List.of(user(bob, "bob")));

        mockMvc.perform(get("/api/users/suggestions").header("Authorization", "Bearer " + TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].username").value("bob"));

        verify(getFollowSuggestionsUseCase).getFollowSuggestions(alice, 5);
    }

    @Test
    void suggestionsShouldRequireToken() throws Exception {
        mockMvc.perform(get("/api/users/suggestions"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(getFollowSuggestionsUseCase);
    }

    @Test
    void shouldFollowUser() throws Exception {
        when(followUserUseCase.followUser(alice, bob)).thenReturn(Result.success(null));

        mockMvc.perform(post("/api/users/" + BOB + "/follow").header("Authorization", "Bearer " + TOKEN))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.message").value("User followed successfully"));
    }

    @Test
    void shouldReportAlreadyFollowingAsBadRequest() throws Exception {
        when(followUserUseCase.followUser(alice, bob))
            .thenReturn(Result.failure(new FollowError.AlreadyFollowing(alice, bob)));

        mockMvc.perform(post("/api/users/" + BOB + "/follow").header("Authorization", "Bearer " + TOKEN))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ALREADY_FOLLOWING"));
    }

    @Test
    void shouldUnfollowUser() throws Exception {
        when(unfollowUserUseCase.unfollow(alice, bob)).thenReturn(Result.success(null));

        mockMvc.perform(delete("/api/users/" + BOB + "/follow").header("Authorization", "Bearer " + TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("User unfollowed successfully"));
    }

    @Test
    void shouldListFollowersWithoutToken() throws Exception {
        when(getFollowersUseCase.getFollowers(eq(bob), any(PageRequest.class)))
            .thenReturn(Page.of(List.of(user(alice, "alice")), new PageRequest(1, 10), 1));

        mockMvc.perform(get("/api/users/" + BOB + "/followers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].username").value("alice"));
    }

    @Test
    void shouldRejectMalformedUserId() throws Exception {
        mockMvc.perform(get("/api/users/not-a-uuid/following"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USER_ID_INVALID_FORMAT"));

        verifyNoInteractions(getFollowingUseCase);
    }
}
