package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.Conversation;
import com.mindcanvus.domain.model.UserId;

import java.util.List;

public interface GetConversationsUseCase {
    List<Conversation> getConversations(UserId userId);
}
