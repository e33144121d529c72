package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.MessageError;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface GetConversationUseCase {

    /**
     * Newest first. Unread messages on the returned page that were sent to {@code userId} are marked read.
     */
    Result<Page<Message>, MessageError> getConversation(UserId userId, UserId otherId, PageRequest pageRequest);
}
