package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FriendError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface RemoveFriendUseCase {
    Result<Void, FriendError> removeFriend(UserId userId, UserId friendId);
}
