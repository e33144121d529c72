package com.mindcanvus.domain.error;

/**
 * Common shape of every expected business error.
 */
public interface DomainError {

    String message();

    String code();

    ErrorKind kind();
}
