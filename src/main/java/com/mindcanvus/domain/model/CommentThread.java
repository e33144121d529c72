package com.mindcanvus.domain.model;

import java.util.List;

/**
 * A top-level comment with its visible replies, oldest first.
 */
public record CommentThread(CommentDetails comment, List<CommentDetails> replies) {

    public CommentThread {
        replies = List.copyOf(replies);
    }
}
