package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface SendFriendRequestUseCase {
    Result<Void, FriendError> sendFriendRequest(UserId requesterId, UserId targetId);
}
