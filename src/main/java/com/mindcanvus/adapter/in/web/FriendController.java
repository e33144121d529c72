package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.AcceptFriendRequestUseCase;
import com.mindcanvus.application.port.in.CancelFriendRequestUseCase;
import com.mindcanvus.application.port.in.GetFriendRequestsUseCase;
import com.mindcanvus.application.port.in.GetFriendSuggestionsUseCase;
import com.mindcanvus.application.port.in.GetFriendsUseCase;
import com.mindcanvus.application.port.in.RejectFriendRequestUseCase;
import com.mindcanvus.application.port.in.RemoveFriendUseCase;
import com.mindcanvus.application.port.in.SendFriendRequestUseCase;
import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.config.AppProperties;
import com.mindcanvus.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;
import java.util.function.BiFunction;

@RestController
@RequestMapping("/api/friends")
@Tag(name = "Friends", description = "Friend requests and mutual friendships")
public class FriendController {

    private final SendFriendRequestUseCase sendFriendRequestUseCase;
    private final AcceptFriendRequestUseCase acceptFriendRequestUseCase;
    private final RejectFriendRequestUseCase rejectFriendRequestUseCase;
    private final CancelFriendRequestUseCase cancelFriendRequestUseCase;
    private final RemoveFriendUseCase removeFriendUseCase;
    private final GetFriendsUseCase getFriendsUseCase;
    private final GetFriendRequestsUseCase getFriendRequestsUseCase;
    private final GetFriendSuggestionsUseCase getFriendSuggestionsUseCase;
    private final AppProperties appProperties;

    public FriendController(
            SendFriendRequestUseCase sendFriendRequestUseCase,
            AcceptFriendRequestUseCase acceptFriendRequestUseCase,
            RejectFriendRequestUseCase rejectFriendRequestUseCase,
            CancelFriendRequestUseCase cancelFriendRequestUseCase,
            RemoveFriendUseCase removeFriendUseCase,
            GetFriendsUseCase getFriendsUseCase,
            GetFriendRequestsUseCase getFriendRequestsUseCase,
            GetFriendSuggestionsUseCase getFriendSuggestionsUseCase,
            AppProperties appProperties) {
        this.sendFriendRequestUseCase = sendFriendRequestUseCase;
        this.acceptFriendRequestUseCase = acceptFriendRequestUseCase;
        this.rejectFriendRequestUseCase = rejectFriendRequestUseCase;
        this.cancelFriendRequestUseCase = cancelFriendRequestUseCase;
        this.removeFriendUseCase = removeFriendUseCase;
        this.getFriendsUseCase = getFriendsUseCase;
        this.getFriendRequestsUseCase = getFriendRequestsUseCase;
        this.getFriendSuggestionsUseCase = getFriendSuggestionsUseCase;
        this.appProperties = appProperties;
    }

    @PostMapping("/request/{userId}")
    @Operation(summary = "Send a friend request")
    public ResponseEntity<?> sendRequest(
            @Parameter(description = "Target user ID", example = "660e8400-e29b-41d4-a716-446655440001")
            @PathVariable String userId) {
        return run(userId, sendFriendRequestUseCase::sendFriendRequest, HttpStatus.CREATED, "Friend request sent");
    }

    @DeleteMapping("/request/{userId}")
    @Operation(summary = "Cancel a sent friend request", description = "Succeeds even if no request is pending")
    public ResponseEntity<?> cancelRequest(@PathVariable String userId) {
        return run(userId, cancelFriendRequestUseCase::cancelFriendRequest, HttpStatus.OK, "Friend request cancelled");
    }

    @PutMapping("/accept/{userId}")
    @Operation(summary = "Accept a friend request", description = "userId is the requester")
    public ResponseEntity<?> acceptRequest(@PathVariable String userId) {
        return run(userId, acceptFriendRequestUseCase::acceptFriendRequest, HttpStatus.OK, "Friend request accepted");
    }

    @PutMapping("/reject/{userId}")
    @Operation(summary = "Reject a friend request", description = "userId is the requester")
    public ResponseEntity<?> rejectRequest(@PathVariable String userId) {
        return run(userId, rejectFriendRequestUseCase::rejectFriendRequest, HttpStatus.OK, "Friend request rejected");
    }

    @DeleteMapping("/{userId}")
    @Operation(summary = "Remove a friend", description = "Removes the friendship on both sides")
    public ResponseEntity<?> removeFriend(@PathVariable String userId) {
        return run(userId, removeFriendUseCase::removeFriend, HttpStatus.OK, "Friend removed");
    }

    @GetMapping
    @Operation(summary = "List friends")
    public ResponseEntity<?> getFriends(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        var friends = getFriendsUseCase.getFriends(RequestContext.getUserId(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(friends, UserResponse::from));
    }

    @GetMapping("/requests")
    @Operation(summary = "Incoming friend requests", description = "Pending requests addressed to the current user")
    public ResponseEntity<?> getIncomingRequests(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        var requests = getFriendRequestsUseCase.getIncomingRequests(
            RequestContext.getUserId(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(requests, FriendRequestResponse::from));
    }

    @GetMapping("/requests/sent")
    @Operation(summary = "Sent friend requests", description = "Users the current user has a pending request out to")
    public ResponseEntity<?> getSentRequests(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        var sent = getFriendRequestsUseCase.getSentRequests(
            RequestContext.getUserId(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(sent, UserResponse::from));
    }

    @GetMapping("/suggestions")
    @Operation(summary = "Friend suggestions", description = "Users other than the caller and their current friends, newest first; pending requests do not exclude a user")
    public ResponseEntity<?> getSuggestions(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        var suggestions = getFriendSuggestionsUseCase.getFriendSuggestions(
            RequestContext.getUserId(), Paging.of(page, limit, appProperties));
        return ResponseEntity.ok(PageResponse.from(suggestions, UserResponse::from));
    }

    private ResponseEntity<?> run(
            String otherUserId,
            BiFunction<UserId, UserId, Result<Void, FriendError>> command,
            HttpStatus successStatus,
            String successMessage) {
        var otherResult = UserId.parse(otherUserId);
        if (otherResult.isFailure()) {
            return ErrorResponses.of(otherResult.errorOrNull());
        }

        Result<Void, FriendError> result = command.apply(RequestContext.getUserId(), otherResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.status(successStatus).body(new StatusResponse(successMessage))
            : ErrorResponses.of(result.errorOrNull());
    }

    public record FriendRequestResponse(
        UUID id,
        UserResponse from,
        String status,
        Instant createdAt
    ) {
        static FriendRequestResponse from(IncomingFriendRequest incoming) {
            return new FriendRequestResponse(
                incoming.request().id(),
                UserResponse.from(incoming.from()),
                incoming.request().status().value(),
                incoming.request().createdAt()
            );
        }
    }
}
