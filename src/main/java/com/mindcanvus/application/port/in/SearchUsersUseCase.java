package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;

public interface SearchUsersUseCase {
    Result<Page<User>, ValidationError> searchUsers(String query, PageRequest pageRequest);
}
