package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.AddCommentUseCase;
import com.mindcanvus.application.port.in.DeleteCommentUseCase;
import com.mindcanvus.application.port.in.EditCommentUseCase;
import com.mindcanvus.application.port.in.GetCommentsUseCase;
import com.mindcanvus.application.port.in.ToggleCommentLikeUseCase;
import com.mindcanvus.application.port.out.CommentRepository;
import com.mindcanvus.application.port.out.IdGenerator;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.CommentError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Comment;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.CommentThread;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class CommentService implements
        AddCommentUseCase,
        EditCommentUseCase,
        DeleteCommentUseCase,
        ToggleCommentLikeUseCase,
        GetCommentsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public CommentService(
            CommentRepository commentRepository,
            PostRepository postRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            Clock clock) {
        this.commentRepository = commentRepository;
        this.postRepository = postRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public Result<CommentDetails, CommentError> addComment(UserId authorId, UUID postId, String content, UUID parentId) {
        Optional<Post> post = postRepository.findById(postId);
        if (post.isEmpty() || !post.get().isVisibleTo(Actor.user(authorId))) {
            return Result.failure(new CommentError.PostNotFound(postId));
        }
        if (!post.get().allowComments()) {
            return Result.failure(new CommentError.CommentsDisabled(postId));
        }

        Comment parent = null;
        if (parentId != null) {
            Optional<Comment> found = commentRepository.findById(parentId);
            if (found.isEmpty()) {
                return Result.failure(new CommentError.ParentNotFound(parentId));
            }
            parent = found.get();
        }

        var commentResult = Comment.create(idGenerator.generate(), postId, authorId, content, parent, clock.instant());
        if (commentResult.isFailure()) {
            log.warn("Comment validation failed: {}", commentResult.errorOrNull().message());
            return Result.failure(new CommentError.ValidationFailed(commentResult.errorOrNull()));
        }
        User author = userRepository.findById(authorId)
            .orElseThrow(() -> new UserNotFoundException(authorId.toString()));

        Comment comment = commentResult.getOrThrow();
        commentRepository.save(comment);

        log.info("Comment added: id={}, post={}, reply={}", comment.id(), postId, comment.isReply());
        return Result.success(new CommentDetails(comment, author, 0));
    }

    @Override
    public Result<CommentDetails, CommentError> editComment(UserId authorId, UUID commentId, String content) {
        Optional<Comment> existing = findLive(commentId);
        if (existing.isEmpty()) {
            return Result.failure(new CommentError.CommentNotFound(commentId));
        }
        Comment comment = existing.get();
        if (!comment.authorId().equals(authorId)) {
            return Result.failure(new CommentError.NotAuthorized("edit"));
        }

        var edited = comment.edit(content, clock.instant());
        if (edited.isFailure()) {
            return Result.failure(new CommentError.ValidationFailed(edited.errorOrNull()));
        }
        commentRepository.update(edited.getOrThrow());
        User author = userRepository.findById(authorId)
            .orElseThrow(() -> new UserNotFoundException(authorId.toString()));

        log.info("Comment edited: id={}", commentId);
        return Result.success(new CommentDetails(edited.getOrThrow(), author, commentRepository.countLikes(commentId)));
    }

    @Override
    public Result<Void, CommentError> deleteComment(Actor actor, UUID commentId) {
        Optional<Comment> existing = findLive(commentId);
        if (existing.isEmpty()) {
            return Result.failure(new CommentError.CommentNotFound(commentId));
        }
        if (!actor.canManage(existing.get().authorId())) {
            return Result.failure(new CommentError.NotAuthorized("delete"));
        }

        commentRepository.update(existing.get().softDelete(clock.instant()));

        log.info("Comment deleted: id={}", commentId);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<LikeToggle, CommentError> toggleLike(UserId userId, UUID commentId) {
        if (findLive(commentId).isEmpty()) {
            return Result.failure(new CommentError.CommentNotFound(commentId));
        }

        boolean liked;
        if (commentRepository.hasLike(commentId, userId)) {
            commentRepository.removeLike(commentId, userId);
            liked = false;
        } else {
            commentRepository.addLike(commentId, userId, clock.instant());
            liked = true;
        }
        return Result.success(new LikeToggle(liked, commentRepository.countLikes(commentId)));
    }

    @Override
    public Result<Page<CommentThread>, CommentError> getComments(UUID postId, CommentSort sort, PageRequest pageRequest) {
        if (postRepository.findById(postId).isEmpty()) {
            return Result.failure(new CommentError.PostNotFound(postId));
        }
        List<CommentDetails> topLevel = commentRepository.findTopLevel(postId, sort, pageRequest.offset(), pageRequest.limit());
        List<CommentThread> threads = CommentThreads.assemble(commentRepository, topLevel);
        return Result.success(Page.of(threads, pageRequest, commentRepository.countTopLevel(postId)));
    }

    @Override
    public Result<Page<CommentDetails>, CommentError> getReplies(UUID commentId, PageRequest pageRequest) {
        if (findLive(commentId).isEmpty()) {
            return Result.failure(new CommentError.CommentNotFound(commentId));
        }
        List<CommentDetails> replies = commentRepository.findReplies(commentId, pageRequest.offset(), pageRequest.limit());
        return Result.success(Page.of(replies, pageRequest, commentRepository.countReplies(commentId)));
    }

    private Optional<Comment> findLive(UUID commentId) {
        return commentRepository.findById(commentId).filter(c -> !c.isDeleted());
    }
}
