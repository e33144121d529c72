package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.Comment;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CommentRepository {
    void save(Comment comment);
    void update(Comment comment);
    Optional<Comment> findById(UUID id);

    /**
     * Non-deleted top-level comments of a post.
     */
    List<CommentDetails> findTopLevel(UUID postId, CommentSort sort, int offset, int limit);
    long countTopLevel(UUID postId);

    /**
     * Non-deleted replies to any of the given comments, oldest first.
     */
    List<CommentDetails> findRepliesOf(List<UUID> parentIds);

    List<CommentDetails> findReplies(UUID parentId, int offset, int limit);
    long countReplies(UUID parentId);

    void deleteByPostId(UUID postId);

    boolean hasLike(UUID commentId, UserId userId);
    void addLike(UUID commentId, UserId userId, Instant now);
    void removeLike(UUID commentId, UserId userId);
    long countLikes(UUID commentId);
}
