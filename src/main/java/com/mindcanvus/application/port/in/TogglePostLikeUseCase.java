package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

import java.util.UUID;

public interface TogglePostLikeUseCase {
    Result<LikeToggle, PostError> toggleLike(UserId userId, UUID postId);
}
