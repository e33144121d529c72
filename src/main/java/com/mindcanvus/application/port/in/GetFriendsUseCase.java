package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

public interface GetFriendsUseCase {
    Page<User> getFriends(UserId userId, PageRequest pageRequest);
}
