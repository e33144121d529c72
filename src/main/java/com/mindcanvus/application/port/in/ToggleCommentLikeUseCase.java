package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

import java.util.UUID;

public interface ToggleCommentLikeUseCase {
    Result<LikeToggle, CommentError> toggleLike(UserId userId, UUID commentId);
}
