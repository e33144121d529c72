package com.mindcanvus.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mindcanvus.domain.model.Comment;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentThread;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CommentResponse(
    UUID id,
    UUID postId,
    UUID parentId,
    String content,
    UserResponse author,
    long likesCount,
    @JsonProperty("isEdited") boolean isEdited,
    Instant editedAt,
    @JsonProperty("isDeleted") boolean isDeleted,
    Instant createdAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) List<CommentResponse> replies
) {
    public static CommentResponse from(CommentDetails details) {
        return from(details, null);
    }

    public static CommentResponse from(CommentThread thread) {
        return from(thread.comment(), thread.replies().stream().map(CommentResponse::from).toList());
    }

    private static CommentResponse from(CommentDetails details, List<CommentResponse> replies) {
        Comment comment = details.comment();
        return new CommentResponse(
            comment.id(),
            comment.postId(),
            comment.parentId(),
            comment.content(),
            UserResponse.from(details.author()),
            details.likesCount(),
            comment.isEdited(),
            comment.editedAt(),
            comment.isDeleted(),
            comment.createdAt(),
            replies
        );
    }
}
