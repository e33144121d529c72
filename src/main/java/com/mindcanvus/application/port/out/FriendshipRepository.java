package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

import java.time.Instant;
import java.util.List;

/**
 * Friend sets, stored one row per direction. Callers keep both directions in step.
 */
public interface FriendshipRepository {
    boolean exists(UserId ownerId, UserId friendId);
    void add(UserId ownerId, UserId friendId, Instant since);
    void remove(UserId ownerId, UserId friendId);

    List<User> findFriends(UserId userId, int offset, int limit);
    long countFriends(UserId userId);

    /**
     * Everyone except the user and their current friends, newest accounts first,
     * then by follower count.
     */
    List<User> findSuggestions(UserId userId, int offset, int limit);
    long countSuggestions(UserId userId);
}
