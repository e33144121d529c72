package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface AcceptFriendRequestUseCase {
    Result<Void, FriendError> acceptFriendRequest(UserId accepterId, UserId requesterId);
}
