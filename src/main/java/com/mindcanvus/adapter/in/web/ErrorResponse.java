package com.mindcanvus.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    String requestId,
    List<FieldViolation> errors
) {
    public ErrorResponse(String error, String message, String requestId) {
        this(error, message, requestId, null);
    }

    public record FieldViolation(String field, String message) {}
}
