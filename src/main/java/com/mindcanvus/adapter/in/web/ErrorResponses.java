package com.mindcanvus.adapter.in.web;

import com.mindcanvus.domain.error.DomainError;
import com.mindcanvus.domain.error.ErrorKind;
import com.mindcanvus.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps expected business errors onto HTTP responses. Conflicts are reported as 400.
 */
final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<ErrorResponse> of(DomainError error) {
        return ResponseEntity.status(statusFor(error.kind()))
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    static ResponseEntity<ErrorResponse> notFound(String code, String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(code, message, RequestContext.getRequestId()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, CONFLICT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
        };
    }
}
