package com.mindcanvus.infrastructure.metrics;

import com.mindcanvus.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter usersRegistered;
    private final Counter postsCreated;
    private final Counter postsPublished;
    private final Counter publishFailures;
    private final Counter friendRequestsSent;
    private final Counter friendshipsCreated;
    private final Counter followsCreated;
    private final Counter unfollows;
    private final Counter messagesSent;

    public AppMetrics(MeterRegistry registry) {
        this.usersRegistered = Counter.builder("users_registered_total")
            .description("Total number of accounts registered")
            .register(registry);

        this.postsCreated = Counter.builder("posts_created_total")
            .description("Total number of posts created")
            .register(registry);

        this.postsPublished = Counter.builder("posts_scheduled_published_total")
            .description("Total number of scheduled posts promoted by the publisher")
            .register(registry);

        this.publishFailures = Counter.builder("posts_scheduled_publish_failures_total")
            .description("Scheduled posts whose promotion failed and were left for the next tick")
            .register(registry);

        this.friendRequestsSent = Counter.builder("friend_requests_sent_total")
            .description("Total number of friend requests sent")
            .register(registry);

        this.friendshipsCreated = Counter.builder("friendships_created_total")
            .description("Total number of accepted friend requests")
            .register(registry);

        this.followsCreated = Counter.builder("follows_created_total")
            .description("Total number of follow actions")
            .register(registry);

        this.unfollows = Counter.builder("unfollows_total")
            .description("Total number of unfollow actions")
            .register(registry);

        this.messagesSent = Counter.builder("messages_sent_total")
            .description("Total number of direct messages sent")
            .register(registry);
    }

    @Override
    public void incrementUsersRegistered() {
        usersRegistered.increment();
    }

    @Override
    public void incrementPostsCreated() {
        postsCreated.increment();
    }

    @Override
    public void incrementPostsPublished(int count) {
        postsPublished.increment(count);
    }

    @Override
    public void incrementPublishFailures() {
        publishFailures.increment();
    }

    @Override
    public void incrementFriendRequestsSent() {
        friendRequestsSent.increment();
    }

    @Override
    public void incrementFriendshipsCreated() {
        friendshipsCreated.increment();
    }

    @Override
    public void incrementFollows() {
        followsCreated.increment();
    }

    @Override
    public void incrementUnfollows() {
        unfollows.increment();
    }

    @Override
    public void incrementMessagesSent() {
        messagesSent.increment();
    }
}
