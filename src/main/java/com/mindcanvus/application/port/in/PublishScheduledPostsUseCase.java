package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.PublishReport;

public interface PublishScheduledPostsUseCase {

    /**
     * Publishes every scheduled post whose time has come. Failures are isolated per post.
     */
    PublishReport publishDuePosts();
}
