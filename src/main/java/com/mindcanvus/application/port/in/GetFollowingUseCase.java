package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

public interface GetFollowingUseCase {
    Page<User> getFollowing(UserId userId, PageRequest pageRequest);
}
