package com.mindcanvus.domain.model;

/**
 * Read model for listings: the post with its author profile and like count.
 */
public record PostDetails(Post post, User author, long likesCount) {

    public PostDetails withViews(long views) {
        return new PostDetails(post.withViews(views), author, likesCount);
    }
}
