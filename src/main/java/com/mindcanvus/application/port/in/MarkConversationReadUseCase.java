package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.MessageError;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface MarkConversationReadUseCase {
    Result<Integer, MessageError> markConversationRead(UserId userId, UserId otherId);
}
