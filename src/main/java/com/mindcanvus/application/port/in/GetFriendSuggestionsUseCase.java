package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

public interface GetFriendSuggestionsUseCase {
    Page<User> getFriendSuggestions(UserId userId, PageRequest pageRequest);
}
