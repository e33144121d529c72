package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.Follow;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

import java.time.Instant;
import java.util.List;

public interface FollowRepository {
    void save(Follow follow);
    void delete(UserId followerId, UserId followeeId);
    boolean exists(UserId followerId, UserId followeeId);

    /**
     * Find users that this user follows, ordered by follow time (newest first).
     */
    List<FollowedUser> findFollowing(UserId userId, int offset, int limit);

    /**
     * Find users that follow this user, ordered by follow time (newest first).
     */
    List<FollowedUser> findFollowers(UserId userId, int offset, int limit);

    /**
     * User with the timestamp of when the follow relationship was created.
     */
    record FollowedUser(User user, Instant followedAt) {}

    long countFollowers(UserId userId);
    long countFollowing(UserId userId);

    /**
     * Users that this user neither follows nor is friends with, most followed first.
     */
    List<User> findSuggestions(UserId userId, int limit);

    long count();
    void deleteAll();
}
