package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.AccountError;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

public record User(
    UserId id,
    String username,
    String email,
    String firstName,
    String lastName,
    String bio,
    String avatar,
    Role role,
    Instant createdAt
) {
    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_]{3,30}$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /**
     * Creates a new account with the default role, returning a Result for expected validation failures.
     * The email is normalized to lower case.
     */
    public static Result<User, AccountError> create(
            UserId id, String username, String email, String firstName, String lastName, Instant now) {
        if (username == null || !USERNAME.matcher(username.trim()).matches()) {
            return Result.failure(new AccountError.InvalidUsername(username));
        }
        if (email == null || !EMAIL.matcher(email.trim()).matches()) {
            return Result.failure(new AccountError.InvalidEmail(email));
        }
        return Result.success(new User(
            id,
            username.trim(),
            normalizeEmail(email),
            blankToNull(firstName),
            blankToNull(lastName),
            null,
            null,
            Role.USER,
            now
        ));
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
