package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface CancelFriendRequestUseCase {
    Result<Void, FriendError> cancelFriendRequest(UserId requesterId, UserId targetId);
}
