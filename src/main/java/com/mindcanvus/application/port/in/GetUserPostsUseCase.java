package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface GetUserPostsUseCase {
    Result<Page<PostDetails>, PostError> getUserPosts(Actor viewer, UserId authorId, PostStatus status, PageRequest pageRequest);
}
