package com.mindcanvus.domain.model;

public enum FriendRequestStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String value;

    FriendRequestStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static FriendRequestStatus fromValue(String value) {
        for (FriendRequestStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalStateException("Unknown friend request status in store: " + value);
    }
}
