package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.CommentThread;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;

import java.util.UUID;

public interface GetCommentsUseCase {
    Result<Page<CommentThread>, CommentError> getComments(UUID postId, CommentSort sort, PageRequest pageRequest);

    Result<Page<CommentDetails>, CommentError> getReplies(UUID commentId, PageRequest pageRequest);
}
