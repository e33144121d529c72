package com.mindcanvus.adapter.in.web;

import com.mindcanvus.domain.model.User;

import java.time.Instant;

/**
 * Public view of an account. Email is only ever returned to its owner, see {@link AuthController}.
 */
public record UserResponse(
    String id,
    String username,
    String firstName,
    String lastName,
    String bio,
    String avatar,
    String role,
    Instant createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(
            user.id().toString(),
            user.username(),
            user.firstName(),
            user.lastName(),
            user.bio(),
            user.avatar(),
            user.role().value(),
            user.createdAt()
        );
    }
}
