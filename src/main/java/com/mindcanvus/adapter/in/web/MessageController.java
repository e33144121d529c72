package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.GetConversationUseCase;
import com.mindcanvus.application.port.in.GetConversationsUseCase;
import com.mindcanvus.application.port.in.GetUnreadCountUseCase;
import com.mindcanvus.application.port.in.MarkConversationReadUseCase;
import com.mindcanvus.application.port.in.SendMessageUseCase;
import com.mindcanvus.domain.error.MessageError;
import com.mindcanvus.domain.model.Conversation;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.config.AppProperties;
import com.mindcanvus.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/messages")
@Tag(name = "Messages", description = "Direct messages between friends")
public class MessageController {

    private final SendMessageUseCase sendMessageUseCase;
    private final GetConversationsUseCase getConversationsUseCase;
    private final GetConversationUseCase getConversationUseCase;
    private final MarkConversationReadUseCase markConversationReadUseCase;
    private final GetUnreadCountUseCase getUnreadCountUseCase;
    private final AppProperties appProperties;

    public MessageController(
            SendMessageUseCase sendMessageUseCase,
            GetConversationsUseCase getConversationsUseCase,
            GetConversationUseCase getConversationUseCase,
            MarkConversationReadUseCase markConversationReadUseCase,
            GetUnreadCountUseCase getUnreadCountUseCase,
            AppProperties appProperties) {
        this.sendMessageUseCase = sendMessageUseCase;
        this.getConversationsUseCase = getConversationsUseCase;
        this.getConversationUseCase = getConversationUseCase;
        this.markConversationReadUseCase = markConversationReadUseCase;
        this.getUnreadCountUseCase = getUnreadCountUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/conversations")
    @Operation(summary = "Inbox", description = "One entry per counterpart, most recent conversation first")
    public List<ConversationResponse> getConversations() {
        return getConversationsUseCase.getConversations(RequestContext.getUserId()).stream()
            .map(ConversationResponse::from)
            .toList();
    }

    @GetMapping("/unread/count")
    @Operation(summary = "Unread message count")
    public UnreadCountResponse getUnreadCount() {
        return new UnreadCountResponse(getUnreadCountUseCase.getUnreadCount(RequestContext.getUserId()));
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Conversation with a user", description = "Newest first; unread messages on the page are marked read")
    public ResponseEntity<?> getConversation(
            @Parameter(description = "Counterpart user ID", example = "660e8400-e29b-41d4-a716-446655440001")
            @PathVariable String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        var otherResult = UserId.parse(userId);
        if (otherResult.isFailure()) {
            return ErrorResponses.of(otherResult.errorOrNull());
        }

        Result<Page<Message>, MessageError> result = getConversationUseCase.getConversation(
            RequestContext.getUserId(), otherResult.getOrThrow(), Paging.of(page, limit, appProperties));

        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), MessageResponse::from))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping("/{userId}")
    @Operation(summary = "Send a message", description = "The recipient must be in the sender's friends")
    public ResponseEntity<?> sendMessage(
            @PathVariable String userId,
            @Valid @RequestBody SendMessageRequest request) {

        var recipientResult = UserId.parse(userId);
        if (recipientResult.isFailure()) {
            return ErrorResponses.of(recipientResult.errorOrNull());
        }

        Result<Message, MessageError> result = sendMessageUseCase.sendMessage(
            RequestContext.getUserId(), recipientResult.getOrThrow(), request.content());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PutMapping("/{userId}/read")
    @Operation(summary = "Mark a conversation read", description = "Marks every unread message from the user as read")
    public ResponseEntity<?> markRead(@PathVariable String userId) {
        var otherResult = UserId.parse(userId);
        if (otherResult.isFailure()) {
            return ErrorResponses.of(otherResult.errorOrNull());
        }

        Result<Integer, MessageError> result =
            markConversationReadUseCase.markConversationRead(RequestContext.getUserId(), otherResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.ok(new MarkReadResponse(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    public record SendMessageRequest(@NotBlank String content) {}

    public record UnreadCountResponse(long count) {}

    public record MarkReadResponse(int updated) {}

    public record ConversationResponse(
        UserResponse user,
        MessageResponse lastMessage,
        long unreadCount
    ) {
        static ConversationResponse from(Conversation conversation) {
            return new ConversationResponse(
                UserResponse.from(conversation.counterpart()),
                MessageResponse.from(conversation.lastMessage()),
                conversation.unreadCount()
            );
        }
    }
}
