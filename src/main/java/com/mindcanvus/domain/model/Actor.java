package com.mindcanvus.domain.model;

/**
 * The caller of a use case. Anonymous callers have no user id.
 */
public record Actor(UserId userId, Role role) {

    public static final Actor ANONYMOUS = new Actor(null, Role.USER);

    public static Actor user(UserId userId) {
        return new Actor(userId, Role.USER);
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * Owners and admins may modify a resource.
     */
    public boolean canManage(UserId ownerId) {
        return isAdmin() || (userId != null && userId.equals(ownerId));
    }
}
