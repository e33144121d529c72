package com.mindcanvus.domain.error;

/**
 * Expected failures of registration and login.
 */
public sealed interface AuthError extends DomainError {

    record UsernameTaken(String username) implements AuthError {
        @Override
        public String message() {
            return "Username is already taken: " + username;
        }

        @Override
        public String code() {
            return "USERNAME_TAKEN";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record EmailTaken(String email) implements AuthError {
        @Override
        public String message() {
            return "An account already exists for " + email;
        }

        @Override
        public String code() {
            return "EMAIL_TAKEN";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }
    }

    record InvalidCredentials() implements AuthError {
        public static final InvalidCredentials INSTANCE = new InvalidCredentials();
        @Override
        public String message() {
            return "Invalid email or password";
        }

        @Override
        public String code() {
            return "INVALID_CREDENTIALS";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.UNAUTHORIZED;
        }
    }

    record ValidationFailed(ValidationError error) implements AuthError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }
    }
}
