package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.AcceptFriendRequestUseCase;
import com.mindcanvus.application.port.in.CancelFriendRequestUseCase;
import com.mindcanvus.application.port.in.GetFriendRequestsUseCase;
import com.mindcanvus.application.port.in.GetFriendSuggestionsUseCase;
import com.mindcanvus.application.port.in.GetFriendsUseCase;
import com.mindcanvus.application.port.in.RejectFriendRequestUseCase;
import com.mindcanvus.application.port.in.RemoveFriendUseCase;
import com.mindcanvus.application.port.in.SendFriendRequestUseCase;
import com.mindcanvus.application.port.out.FriendRequestRepository;
import com.mindcanvus.application.port.out.FriendshipRepository;
import com.mindcanvus.application.port.out.IdGenerator;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.FriendRequest;
import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Friend-request lifecycle. A request is stored only while pending: accept, reject and cancel
 * all consume it, returning the ordered pair to the no-request state. Friendships are stored
 * in both directions and always written or removed together inside one transaction.
 */
@Service
public class FriendService implements
        SendFriendRequestUseCase,
        AcceptFriendRequestUseCase,
        RejectFriendRequestUseCase,
        CancelFriendRequestUseCase,
        RemoveFriendUseCase,
        GetFriendsUseCase,
        GetFriendRequestsUseCase,
        GetFriendSuggestionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(FriendService.class);

    private final FriendRequestRepository friendRequestRepository;
    private final FriendshipRepository friendshipRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public FriendService(
            FriendRequestRepository friendRequestRepository,
            FriendshipRepository friendshipRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.friendRequestRepository = friendRequestRepository;
        this.friendshipRepository = friendshipRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<Void, FriendError> sendFriendRequest(UserId requesterId, UserId targetId) {
        log.debug("Processing friend request: from={}, to={}", requesterId, targetId);

        var requestResult = FriendRequest.create(idGenerator.generate(), requesterId, targetId, clock.instant());
        if (requestResult.isFailure()) {
            log.warn("Friend request validation failed: {}", requestResult.errorOrNull().message());
            return Result.failure(new FriendError.ValidationFailed(requestResult.errorOrNull()));
        }

        if (!userRepository.exists(targetId)) {
            return Result.failure(new FriendError.UserNotFound(targetId));
        }
        if (friendshipRepository.exists(requesterId, targetId)) {
            return Result.failure(new FriendError.AlreadyFriends(requesterId, targetId));
        }
        if (friendRequestRepository.findPending(requesterId, targetId).isPresent()) {
            return Result.failure(new FriendError.DuplicateRequest(requesterId, targetId));
        }

        try {
            friendRequestRepository.save(requestResult.getOrThrow());
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent duplicate friend request: from={}, to={}", requesterId, targetId);
            return Result.failure(new FriendError.DuplicateRequest(requesterId, targetId));
        }

        metrics.incrementFriendRequestsSent();
        log.info("Friend request sent: {} -> {}", requesterId, targetId);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FriendError> acceptFriendRequest(UserId accepterId, UserId requesterId) {
        log.debug("Processing friend accept: accepter={}, requester={}", accepterId, requesterId);

        if (!userRepository.exists(requesterId)) {
            return Result.failure(new FriendError.UserNotFound(requesterId));
        }
        if (friendRequestRepository.findPending(requesterId, accepterId).isEmpty()) {
            return Result.failure(new FriendError.RequestNotFound(requesterId, accepterId));
        }
        if (friendshipRepository.exists(accepterId, requesterId) || friendshipRepository.exists(requesterId, accepterId)) {
            return Result.failure(new FriendError.AlreadyFriends(accepterId, requesterId));
        }

        Instant now = clock.instant();
        friendshipRepository.add(accepterId, requesterId, now);
        friendshipRepository.add(requesterId, accepterId, now);
        friendRequestRepository.deleteByPair(requesterId, accepterId);
        // a crossed request in the other direction is settled by this friendship too
        friendRequestRepository.deleteByPair(accepterId, requesterId);

        metrics.incrementFriendshipsCreated();
        log.info("Friend request accepted: {} <-> {}", requesterId, accepterId);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FriendError> rejectFriendRequest(UserId accepterId, UserId requesterId) {
        log.debug("Processing friend reject: accepter={}, requester={}", accepterId, requesterId);

        if (friendRequestRepository.findPending(requesterId, accepterId).isEmpty()) {
            return Result.failure(new FriendError.RequestNotFound(requesterId, accepterId));
        }

        friendRequestRepository.deleteByPair(requesterId, accepterId);

        log.info("Friend request rejected: {} -> {}", requesterId, accepterId);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FriendError> cancelFriendRequest(UserId requesterId, UserId targetId) {
        if (!userRepository.exists(targetId)) {
            return Result.failure(new FriendError.UserNotFound(targetId));
        }

        int removed = friendRequestRepository.deleteByPair(requesterId, targetId);

        log.info("Friend request cancelled: {} -> {} (removed={})", requesterId, targetId, removed);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FriendError> removeFriend(UserId userId, UserId friendId) {
        log.debug("Processing friend removal: user={}, friend={}", userId, friendId);

        if (!userRepository.exists(friendId)) {
            return Result.failure(new FriendError.UserNotFound(friendId));
        }
        if (!friendshipRepository.exists(userId, friendId)) {
            return Result.failure(new FriendError.NotFriends(userId, friendId));
        }

        friendshipRepository.remove(userId, friendId);
        friendshipRepository.remove(friendId, userId);

        log.info("Friendship removed: {} <-> {}", userId, friendId);
        return Result.success(null);
    }

    @Override
    public Page<User> getFriends(UserId userId, PageRequest pageRequest) {
        return Page.of(
            friendshipRepository.findFriends(userId, pageRequest.offset(), pageRequest.limit()),
            pageRequest,
            friendshipRepository.countFriends(userId)
        );
    }

    @Override
    public Page<IncomingFriendRequest> getIncomingRequests(UserId userId, PageRequest pageRequest) {
        return Page.of(
            friendRequestRepository.findIncoming(userId, pageRequest.offset(), pageRequest.limit()),
            pageRequest,
            friendRequestRepository.countIncoming(userId)
        );
    }

    @Override
    public Page<User> getSentRequests(UserId userId, PageRequest pageRequest) {
        return Page.of(
            friendRequestRepository.findSentTo(userId, pageRequest.offset(), pageRequest.limit()),
            pageRequest,
            friendRequestRepository.countSent(userId)
        );
    }

    @Override
    public Page<User> getFriendSuggestions(UserId userId, PageRequest pageRequest) {
        return Page.of(
            friendshipRepository.findSuggestions(userId, pageRequest.offset(), pageRequest.limit()),
            pageRequest,
            friendshipRepository.countSuggestions(userId)
        );
    }
}
