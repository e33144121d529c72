package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.MessageError;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;

public interface SendMessageUseCase {
    Result<Message, MessageError> sendMessage(UserId senderId, UserId recipientId, String content);
}
