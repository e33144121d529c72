package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Result;

import java.util.UUID;

public interface DeleteCommentUseCase {
    Result<Void, CommentError> deleteComment(Actor actor, UUID commentId);
}
