package com.mindcanvus.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementUsersRegistered();

    void incrementPostsCreated();

    void incrementPostsPublished(int count);

    void incrementPublishFailures();

    void incrementFriendRequestsSent();

    void incrementFriendshipsCreated();

    void incrementFollows();

    void incrementUnfollows();

    void incrementMessagesSent();
}
