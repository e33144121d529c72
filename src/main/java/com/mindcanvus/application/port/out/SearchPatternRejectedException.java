package com.mindcanvus.application.port.out;

/**
 * Thrown by a repository when the store's regex engine refuses a search pattern
 * that passed the application's own syntax check.
 */
public class SearchPatternRejectedException extends RuntimeException {

    private final String pattern;

    public SearchPatternRejectedException(String pattern, Throwable cause) {
        super("Search pattern rejected by the database: " + pattern, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
