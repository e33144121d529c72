package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.GetConversationUseCase;
import com.mindcanvus.application.port.in.GetConversationsUseCase;
import com.mindcanvus.application.port.in.GetUnreadCountUseCase;
import com.mindcanvus.application.port.in.MarkConversationReadUseCase;
import com.mindcanvus.application.port.in.SendMessageUseCase;
import com.mindcanvus.application.port.out.FriendshipRepository;
import com.mindcanvus.application.port.out.IdGenerator;
import com.mindcanvus.application.port.out.MessageRepository;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.MessageError;
import com.mindcanvus.domain.model.Conversation;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class MessageService implements
        SendMessageUseCase,
        GetConversationsUseCase,
        GetConversationUseCase,
        MarkConversationReadUseCase,
        GetUnreadCountUseCase {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageRepository messageRepository;
    private final FriendshipRepository friendshipRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public MessageService(
            MessageRepository messageRepository,
            FriendshipRepository friendshipRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.messageRepository = messageRepository;
        this.friendshipRepository = friendshipRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<Message, MessageError> sendMessage(UserId senderId, UserId recipientId, String content) {
        var messageResult = Message.create(idGenerator.generate(), senderId, recipientId, content, clock.instant());
        if (messageResult.isFailure()) {
            log.warn("Message validation failed: {}", messageResult.errorOrNull().message());
            return Result.failure(new MessageError.ValidationFailed(messageResult.errorOrNull()));
        }
        if (!userRepository.exists(recipientId)) {
            return Result.failure(new MessageError.UserNotFound(recipientId));
        }
        // only the sender's side of the friendship is consulted
        if (!friendshipRepository.exists(senderId, recipientId)) {
            log.warn("Rejected message from {} to non-friend {}", senderId, recipientId);
            return Result.failure(new MessageError.NotFriends(senderId, recipientId));
        }

        Message message = messageResult.getOrThrow();
        messageRepository.save(message);

        metrics.incrementMessagesSent();
        log.info("Message sent: id={}, {} -> {}", message.id(), senderId, recipientId);
        return Result.success(message);
    }

    @Override
    public List<Conversation> getConversations(UserId userId) {
        return messageRepository.findConversations(userId);
    }

    @Override
    @Transactional
    public Result<Page<Message>, MessageError> getConversation(UserId userId, UserId otherId, PageRequest pageRequest) {
        if (!userRepository.exists(otherId)) {
            return Result.failure(new MessageError.UserNotFound(otherId));
        }

        List<Message> messages = messageRepository.findConversation(userId, otherId, pageRequest.offset(), pageRequest.limit());
        long total = messageRepository.countConversation(userId, otherId);

        List<UUID> unreadIds = messages.stream()
            .filter(m -> m.isUnreadFor(userId))
            .map(Message::id)
            .toList();
        if (!unreadIds.isEmpty()) {
            Instant now = clock.instant();
            messageRepository.markRead(unreadIds, now);
            messages = messages.stream()
                .map(m -> m.isUnreadFor(userId) ? m.markRead(now) : m)
                .toList();
            log.debug("Marked {} messages read for user={}", unreadIds.size(), userId);
        }

        return Result.success(Page.of(messages, pageRequest, total));
    }

    @Override
    public Result<Integer, MessageError> markConversationRead(UserId userId, UserId otherId) {
        if (!userRepository.exists(otherId)) {
            return Result.failure(new MessageError.UserNotFound(otherId));
        }
        int updated = messageRepository.markConversationRead(otherId, userId, clock.instant());
        log.debug("Marked conversation read: user={}, other={}, updated={}", userId, otherId, updated);
        return Result.success(updated);
    }

    @Override
    public long getUnreadCount(UserId userId) {
        return messageRepository.countUnread(userId);
    }
}
