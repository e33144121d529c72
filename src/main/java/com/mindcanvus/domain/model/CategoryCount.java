package com.mindcanvus.domain.model;

public record CategoryCount(Category category, long count) {}
