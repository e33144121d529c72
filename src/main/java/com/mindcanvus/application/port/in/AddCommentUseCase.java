package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

import java.util.UUID;

public interface AddCommentUseCase {

    /**
     * @param parentId the top-level comment being replied to, or null
     */
    Result<CommentDetails, CommentError> addComment(UserId authorId, UUID postId, String content, UUID parentId);
}
