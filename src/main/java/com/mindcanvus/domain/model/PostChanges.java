package com.mindcanvus.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a post. Null fields are left unchanged.
 */
public record PostChanges(
    String title,
    String content,
    String excerpt,
    Category category,
    PostStatus status,
    Instant scheduledFor,
    List<String> tags,
    String featuredImage,
    Boolean isPublic,
    Boolean allowComments
) {}
