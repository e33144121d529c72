package com.mindcanvus.domain.model;

/**
 * A pending request as shown to its recipient, with the requester's profile.
 */
public record IncomingFriendRequest(FriendRequest request, User from) {}
