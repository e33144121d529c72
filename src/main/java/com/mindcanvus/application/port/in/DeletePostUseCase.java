package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Result;

import java.util.UUID;

public interface DeletePostUseCase {
    Result<Void, PostError> deletePost(Actor actor, UUID postId);
}
