package com.mindcanvus.domain.model;

/**
 * State after flipping a like: whether the user now likes the item, and the new total.
 */
public record LikeToggle(boolean liked, long likesCount) {}
