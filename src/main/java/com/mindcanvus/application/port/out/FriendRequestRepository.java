package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.FriendRequest;
import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

import java.util.List;
import java.util.Optional;

public interface FriendRequestRepository {

    /**
     * Inserts a pending request.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a request for the pair already exists
     */
    void save(FriendRequest request);

    Optional<FriendRequest> findPending(UserId fromUserId, UserId toUserId);

    /**
     * Removes the request for the ordered pair, if any. Returns the number of rows removed.
     */
    int deleteByPair(UserId fromUserId, UserId toUserId);

    /**
     * Pending requests addressed to the user, oldest first.
     */
    List<IncomingFriendRequest> findIncoming(UserId toUserId, int offset, int limit);
    long countIncoming(UserId toUserId);

    /**
     * Users holding a pending request from this user, oldest request first.
     */
    List<User> findSentTo(UserId fromUserId, int offset, int limit);
    long countSent(UserId fromUserId);
}
