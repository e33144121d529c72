package com.mindcanvus.infrastructure.exception;

/**
 * Base class for business failures that cannot be expressed as a Result,
 * such as a valid token whose account no longer exists.
 */
public abstract class BusinessException extends RuntimeException {

    private final String errorCode;

    protected BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
