package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.AddCommentUseCase;
import com.mindcanvus.application.port.in.DeleteCommentUseCase;
import com.mindcanvus.application.port.in.EditCommentUseCase;
import com.mindcanvus.application.port.in.GetCommentsUseCase;
import com.mindcanvus.application.port.in.ToggleCommentLikeUseCase;
import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.CommentThread;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.infrastructure.config.AppProperties;
import com.mindcanvus.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/comments")
@Tag(name = "Comments", description = "Comments and one level of replies on posts")
public class CommentController {

    private final AddCommentUseCase addCommentUseCase;
    private final EditCommentUseCase editCommentUseCase;
    private final DeleteCommentUseCase deleteCommentUseCase;
    private final ToggleCommentLikeUseCase toggleCommentLikeUseCase;
    private final GetCommentsUseCase getCommentsUseCase;
    private final AppProperties appProperties;

    public CommentController(
            AddCommentUseCase addCommentUseCase,
            EditCommentUseCase editCommentUseCase,
            DeleteCommentUseCase deleteCommentUseCase,
            ToggleCommentLikeUseCase toggleCommentLikeUseCase,
            GetCommentsUseCase getCommentsUseCase,
            AppProperties appProperties) {
        this.addCommentUseCase = addCommentUseCase;
        this.editCommentUseCase = editCommentUseCase;
        this.deleteCommentUseCase = deleteCommentUseCase;
        this.toggleCommentLikeUseCase = toggleCommentLikeUseCase;
        this.getCommentsUseCase = getCommentsUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/post/{postId}")
    @Operation(summary = "Comments of a post", description = "Top-level comments, each with its replies oldest first")
    public ResponseEntity<?> getComments(
            @PathVariable UUID postId,
            @Parameter(description = "newest or oldest")
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        Result<Page<CommentThread>, CommentError> result = getCommentsUseCase.getComments(
            postId, CommentSort.fromParam(sort), Paging.of(page, limit, appProperties));

        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), CommentResponse::from))
            : ErrorResponses.of(result.errorOrNull());
    }

    @GetMapping("/{id}/replies")
    @Operation(summary = "Replies to a comment", description = "Oldest first")
    public ResponseEntity<?> getReplies(
            @PathVariable UUID id,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        Result<Page<CommentDetails>, CommentError> result =
            getCommentsUseCase.getReplies(id, Paging.of(page, limit, appProperties));

        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), CommentResponse::from))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping
    @Operation(summary = "Comment on a post", description = "Set parentId to reply to a top-level comment")
    public ResponseEntity<?> addComment(@Valid @RequestBody CreateCommentRequest request) {
        Result<CommentDetails, CommentError> result = addCommentUseCase.addComment(
            RequestContext.getUserId(), request.postId(), request.content(), request.parentId());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit a comment", description = "Author only")
    public ResponseEntity<?> editComment(@PathVariable UUID id, @Valid @RequestBody EditCommentRequest request) {
        Result<CommentDetails, CommentError> result =
            editCommentUseCase.editComment(RequestContext.getUserId(), id, request.content());

        return result.isSuccess()
            ? ResponseEntity.ok(CommentResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a comment", description = "Soft delete by the author or an admin")
    public ResponseEntity<?> deleteComment(@PathVariable UUID id) {
        Result<Void, CommentError> result = deleteCommentUseCase.deleteComment(RequestContext.getActor(), id);

        return result.isSuccess()
            ? ResponseEntity.ok(new StatusResponse("Comment deleted successfully"))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping("/{id}/like")
    @Operation(summary = "Like or unlike a comment")
    public ResponseEntity<?> toggleLike(@PathVariable UUID id) {
        Result<LikeToggle, CommentError> result = toggleCommentLikeUseCase.toggleLike(RequestContext.getUserId(), id);

        return result.isSuccess()
            ? ResponseEntity.ok(LikeResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    public record CreateCommentRequest(
        @NotNull UUID postId,
        @NotBlank String content,
        UUID parentId
    ) {}

    public record EditCommentRequest(@NotBlank String content) {}
}
