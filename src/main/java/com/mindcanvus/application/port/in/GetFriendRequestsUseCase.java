package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

public interface GetFriendRequestsUseCase {

    /**
     * Pending requests addressed to the user, oldest first.
     */
    Page<IncomingFriendRequest> getIncomingRequests(UserId userId, PageRequest pageRequest);

    /**
     * Users the given user has a pending request out to.
     */
    Page<User> getSentRequests(UserId userId, PageRequest pageRequest);
}
