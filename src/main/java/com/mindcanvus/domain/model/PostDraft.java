package com.mindcanvus.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Author input for a new post. Category is already parsed; status defaults to draft when null.
 */
public record PostDraft(
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
