package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.AuthError;
import com.mindcanvus.domain.model.AuthSession;
import com.mindcanvus.domain.model.Result;

public interface RegisterUseCase {
    Result<AuthSession, AuthError> register(RegisterCommand command);

    record RegisterCommand(String username, String email, String password, String firstName, String lastName) {}
}
