package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.PostView;
import com.mindcanvus.domain.model.Result;

import java.util.UUID;

public interface GetPostUseCase {

    /**
     * Opens a post and counts the view. Posts the viewer may not see are reported as not found.
     */
    Result<PostView, PostError> getPost(Actor viewer, UUID postId);
}
