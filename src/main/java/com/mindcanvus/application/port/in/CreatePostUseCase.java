package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostDraft;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface CreatePostUseCase {
    Result<PostDetails, PostError> createPost(UserId authorId, PostDraft draft);
}
