package com.mindcanvus.domain.model;

public record CommentDetails(Comment comment, User author, long likesCount) {}
