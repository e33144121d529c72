package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface FollowUserUseCase {
    Result<Void, FollowError> followUser(UserId followerId, UserId followeeId);
}
