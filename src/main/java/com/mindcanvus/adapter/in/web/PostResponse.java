package com.mindcanvus.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PostDetails;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PostResponse(
    UUID id,
    String title,
    String content,
    String excerpt,
    String category,
    String status,
    Instant scheduledFor,
    Instant publishedAt,
    long views,
    List<String> tags,
    String featuredImage,
    @JsonProperty("isPublic") boolean isPublic,
    @JsonProperty("allowComments") boolean allowComments,
    UserResponse author,
    long likesCount,
    Instant createdAt,
    Instant updatedAt
) {
    public static PostResponse from(PostDetails details) {
        Post post = details.post();
        return new PostResponse(
            post.id(),
            post.title(),
            post.content(),
            post.excerpt(),
            post.category().label(),
            post.status().value(),
            post.scheduledFor(),
            post.publishedAt(),
            post.views(),
            post.tags(),
            post.featuredImage(),
            post.isPublic(),
            post.allowComments(),
            UserResponse.from(details.author()),
            details.likesCount(),
            post.createdAt(),
            post.updatedAt()
        );
    }
}
