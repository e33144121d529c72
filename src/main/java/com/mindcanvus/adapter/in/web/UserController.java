package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.FollowUserUseCase;
import com.mindcanvus.application.port.in.GetFollowSuggestionsUseCase;
import com.mindcanvus.application.port.in.GetFollowersUseCase;
import com.mindcanvus.application.port.in.GetFollowingUseCase;
import com.mindcanvus.application.port.in.GetUserProfileUseCase;
import com.mindcanvus.application.port.in.SearchUsersUseCase;
import com.mindcanvus.application.port.in.UnfollowUserUseCase;
import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.domain.model.UserProfile;
import com.mindcanvus.infrastructure.config.AppProperties;
import com.mindcanvus.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Profiles, search and follows")
public class UserController {

    private static final int DEFAULT_SUGGESTIONS = 5;

    private final GetUserProfileUseCase getUserProfileUseCase;
    private final SearchUsersUseCase searchUsersUseCase;
    private final GetFollowSuggestionsUseCase getFollowSuggestionsUseCase;
    private final FollowUserUseCase followUserUseCase;
    private final UnfollowUserUseCase unfollowUserUseCase;
    private final GetFollowersUseCase getFollowersUseCase;
    private final GetFollowingUseCase getFollowingUseCase;
    private final AppProperties appProperties;

    public UserController(
            GetUserProfileUseCase getUserProfileUseCase,
            SearchUsersUseCase searchUsersUseCase,
            GetFollowSuggestionsUseCase getFollowSuggestionsUseCase,
            FollowUserUseCase followUserUseCase,
            UnfollowUserUseCase unfollowUserUseCase,
            GetFollowersUseCase getFollowersUseCase,
            GetFollowingUseCase getFollowingUseCase,
            AppProperties appProperties) {
        this.getUserProfileUseCase = getUserProfileUseCase;
        this.searchUsersUseCase = searchUsersUseCase;
        this.getFollowSuggestionsUseCase = getFollowSuggestionsUseCase;
        this.followUserUseCase = followUserUseCase;
        this.unfollowUserUseCase = unfollowUserUseCase;
        this.getFollowersUseCase = getFollowersUseCase;
        this.getFollowingUseCase = getFollowingUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/search")
    @Operation(summary = "Search users", description = "Case-insensitive regex over username, first and last name")
    public ResponseEntity<?> search(
            @Parameter(description = "Regular expression", example = "^ali")
            @RequestParam String q,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        Result<Page<User>, ValidationError> result =
            searchUsersUseCase.searchUsers(q, Paging.of(page, limit, appProperties));

        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), UserResponse::from))
            : ErrorResponses.of(result.errorOrNull());
    }

    @GetMapping("/suggestions")
    @Operation(summary = "Who to follow", description = "Users not yet followed and not friends, most followed first")
    public List<UserResponse> suggestions(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit == null || limit < 1
            ? DEFAULT_SUGGESTIONS
            : Math.min(limit, appProperties.getPagination().getMaxLimit());
        return getFollowSuggestionsUseCase.getFollowSuggestions(RequestContext.getUserId(), effectiveLimit).stream()
            .map(UserResponse::from)
            .toList();
    }

    @GetMapping("/{username}")
    @Operation(summary = "User profile", description = "Profile with follower, following, friend and post counts")
    public ResponseEntity<?> profile(@PathVariable String username) {
        return getUserProfileUseCase.getProfile(username)
            .<ResponseEntity<?>>map(profile -> ResponseEntity.ok(ProfileResponse.from(profile)))
            .orElseGet(() -> ErrorResponses.notFound("USER_NOT_FOUND", "User not found: " + username));
    }

    @GetMapping("/{userId}/followers")
    @Operation(summary = "Followers", description = "Users following the specified user, newest first")
    public ResponseEntity<?> followers(
            @Parameter(description = "User ID", example = "550e8400-e29b-41d4-a716-446655440000")
            @PathVariable String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return ErrorResponses.of(userIdResult.errorOrNull());
        }
        Page<User> followers = getFollowersUseCase.getFollowers(userIdResult.getOrThrow(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(followers, UserResponse::from));
    }

    @GetMapping("/{userId}/following")
    @Operation(summary = "Following", description = "Users the specified user follows, newest first")
    public ResponseEntity<?> following(
            @PathVariable String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return ErrorResponses.of(userIdResult.errorOrNull());
        }
        Page<User> following = getFollowingUseCase.getFollowing(userIdResult.getOrThrow(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(following, UserResponse::from));
    }

    @PostMapping("/{userId}/follow")
    @Operation(summary = "Follow a user")
    public ResponseEntity<?> follow(@PathVariable String userId) {
        var targetResult = UserId.parse(userId);
        if (targetResult.isFailure()) {
            return ErrorResponses.of(targetResult.errorOrNull());
        }

        Result<Void, FollowError> result = followUserUseCase.followUser(RequestContext.getUserId(), targetResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new StatusResponse("User followed successfully"))
            : ErrorResponses.of(result.errorOrNull());
    }

    @DeleteMapping("/{userId}/follow")
    @Operation(summary = "Unfollow a user")
    public ResponseEntity<?> unfollow(@PathVariable String userId) {
        var targetResult = UserId.parse(userId);
        if (targetResult.isFailure()) {
            return ErrorResponses.of(targetResult.errorOrNull());
        }

        Result<Void, FollowError> result = unfollowUserUseCase.unfollow(RequestContext.getUserId(), targetResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.ok(new StatusResponse("User unfollowed successfully"))
            : ErrorResponses.of(result.errorOrNull());
    }

    public record ProfileResponse(
        UserResponse user,
        long followersCount,
        long followingCount,
        long friendsCount,
        long postsCount
    ) {
        static ProfileResponse from(UserProfile profile) {
            return new ProfileResponse(
                UserResponse.from(profile.user()),
                profile.followersCount(),
                profile.followingCount(),
                profile.friendsCount(),
                profile.postsCount()
            );
        }
    }
}
