package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

import java.util.UUID;

public interface EditCommentUseCase {
    Result<CommentDetails, CommentError> editComment(UserId authorId, UUID commentId, String content);
}
