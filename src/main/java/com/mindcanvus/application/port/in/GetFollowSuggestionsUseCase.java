package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

import java.util.List;

public interface GetFollowSuggestionsUseCase {
    List<User> getFollowSuggestions(UserId userId, int limit);
}
