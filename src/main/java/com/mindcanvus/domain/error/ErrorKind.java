package com.mindcanvus.domain.error;

/**
 * Coarse classification of an expected failure. The web layer maps each kind to one HTTP status.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    FORBIDDEN,
    CONFLICT,
    UNAUTHORIZED
}
