package com.mindcanvus.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mindcanvus.domain.model.LikeToggle;

public record LikeResponse(
    @JsonProperty("isLiked") boolean isLiked,
    long likesCount
) {
    public static LikeResponse from(LikeToggle toggle) {
        return new LikeResponse(toggle.liked(), toggle.likesCount());
    }
}
