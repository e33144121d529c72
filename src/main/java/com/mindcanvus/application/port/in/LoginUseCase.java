package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.AuthError;
import com.mindcanvus.domain.model.AuthSession;
import com.mindcanvus.domain.model.Result;

public interface LoginUseCase {
    Result<AuthSession, AuthError> login(String email, String password);
}
