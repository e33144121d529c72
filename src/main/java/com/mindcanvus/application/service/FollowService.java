package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.FollowUserUseCase;
import com.mindcanvus.application.port.in.GetFollowersUseCase;
import com.mindcanvus.application.port.in.GetFollowingUseCase;
import com.mindcanvus.application.port.in.UnfollowUserUseCase;
import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.model.Follow;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
public class FollowService implements FollowUserUseCase, UnfollowUserUseCase, GetFollowingUseCase, GetFollowersUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final MetricsPort metrics;
    private final Clock clock;

    public FollowService(
            FollowRepository followRepository,
            UserRepository userRepository,
            MetricsPort metrics,
            Clock clock) {
        this.followRepository = followRepository;
        this.userRepository = userRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<Void, FollowError> followUser(UserId followerId, UserId followeeId) {
        log.debug("Processing follow request: follower={}, followee={}", followerId, followeeId);

        var followResult = Follow.create(followerId, followeeId, clock.instant());
        if (followResult.isFailure()) {
            log.warn("Follow validation failed: {}", followResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(followResult.errorOrNull()));
        }

        if (!userRepository.exists(followeeId)) {
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        if (followRepository.exists(followerId, followeeId)) {
            log.debug("Already following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.AlreadyFollowing(followerId, followeeId));
        }

        followRepository.save(followResult.getOrThrow());

        metrics.incrementFollows();
        log.info("Follow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FollowError> unfollow(UserId followerId, UserId followeeId) {
        log.debug("Processing unfollow request: follower={}, followee={}", followerId, followeeId);

        if (!userRepository.exists(followeeId)) {
            return Result.failure(new FollowError.UserNotFound(followeeId));
        }

        if (!followRepository.exists(followerId, followeeId)) {
            log.debug("Not following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.NotFollowing(followerId, followeeId));
        }

        followRepository.delete(followerId, followeeId);

        metrics.incrementUnfollows();
        log.info("Unfollow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }

    @Override
    public Page<User> getFollowing(UserId userId, PageRequest pageRequest) {
        List<User> users = followRepository.findFollowing(userId, pageRequest.offset(), pageRequest.limit()).stream()
            .map(FollowRepository.FollowedUser::user)
            .toList();
        return Page.of(users, pageRequest, followRepository.countFollowing(userId));
    }

    @Override
    public Page<User> getFollowers(UserId userId, PageRequest pageRequest) {
        List<User> users = followRepository.findFollowers(userId, pageRequest.offset(), pageRequest.limit()).stream()
            .map(FollowRepository.FollowedUser::user)
            .toList();
        return Page.of(users, pageRequest, followRepository.countFollowers(userId));
    }
}
