package com.mindcanvus.domain.model;

/**
 * Public profile with social graph and content counters.
 */
public record UserProfile(
    User user,
    long followersCount,
    long followingCount,
    long friendsCount,
    long postsCount
) {}
