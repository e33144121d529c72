package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.UserId;

public interface GetUnreadCountUseCase {
    long getUnreadCount(UserId userId);
}
