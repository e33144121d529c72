package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.PostChanges;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.Result;

import java.util.UUID;

public interface UpdatePostUseCase {
    Result<PostDetails, PostError> updatePost(Actor actor, UUID postId, PostChanges changes);
}
