package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.FollowError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface UnfollowUserUseCase {
    Result<Void, FollowError> unfollow(UserId followerId, UserId followeeId);
}
