package com.mindcanvus.domain.model;

import java.util.List;

/**
 * A single post as opened by a reader, with the first page of its comment threads.
 */
public record PostView(PostDetails details, List<CommentThread> comments) {}
