package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

public interface GetCurrentUserUseCase {

    /**
     * @throws com.mindcanvus.infrastructure.exception.UserNotFoundException if the account behind a valid token is gone
     */
    User getCurrentUser(UserId userId);
}
