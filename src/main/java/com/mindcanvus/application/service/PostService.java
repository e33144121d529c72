package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.CreatePostUseCase;
import com.mindcanvus.application.port.in.DeletePostUseCase;
import com.mindcanvus.application.port.in.GetCategoryCountsUseCase;
import com.mindcanvus.application.port.in.GetPostUseCase;
import com.mindcanvus.application.port.in.GetUserPostsUseCase;
import com.mindcanvus.application.port.in.ListPostsUseCase;
import com.mindcanvus.application.port.in.TogglePostLikeUseCase;
import com.mindcanvus.application.port.in.UpdatePostUseCase;
import com.mindcanvus.application.port.out.CommentRepository;
import com.mindcanvus.application.port.out.IdGenerator;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.application.port.out.SearchPatternRejectedException;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.CategoryCount;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.CommentThread;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PostChanges;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostDraft;
import com.mindcanvus.domain.model.PostFilter;
import com.mindcanvus.domain.model.PostSort;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.PostView;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class PostService implements
        CreatePostUseCase,
        UpdatePostUseCase,
        DeletePostUseCase,
        ListPostsUseCase,
        GetPostUseCase,
        GetUserPostsUseCase,
        TogglePostLikeUseCase,
        GetCategoryCountsUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    static final int COMMENTS_ON_POST_PAGE = 20;

    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public PostService(
            PostRepository postRepository,
            CommentRepository commentRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<PostDetails, PostError> createPost(UserId authorId, PostDraft draft) {
        log.debug("Creating post for author={}", authorId);

        var postResult = Post.create(idGenerator.generate(), authorId, draft, clock.instant());
        if (postResult.isFailure()) {
            log.warn("Post validation failed: {}", postResult.errorOrNull().message());
            return Result.failure(new PostError.ValidationFailed(postResult.errorOrNull()));
        }
        User author = userRepository.findById(authorId)
            .orElseThrow(() -> new UserNotFoundException(authorId.toString()));

        Post post = postResult.getOrThrow();
        postRepository.save(post);

        metrics.incrementPostsCreated();
        log.info("Post created: id={}, author={}, status={}", post.id(), authorId, post.status().value());

        return Result.success(new PostDetails(post, author, 0));
    }

    @Override
    public Result<PostDetails, PostError> updatePost(Actor actor, UUID postId, PostChanges changes) {
        Optional<Post> existing = postRepository.findById(postId);
        if (existing.isEmpty()) {
            return Result.failure(new PostError.PostNotFound(postId));
        }
        Post post = existing.get();
        if (!actor.canManage(post.authorId())) {
            log.warn("Rejected update of post {} by {}", postId, actor.userId());
            return Result.failure(new PostError.NotAuthorized("update"));
        }

        var updated = post.apply(changes, clock.instant());
        if (updated.isFailure()) {
            log.warn("Post update validation failed: {}", updated.errorOrNull().message());
            return Result.failure(new PostError.ValidationFailed(updated.errorOrNull()));
        }
        postRepository.update(updated.getOrThrow());
        log.info("Post updated: id={}, status={}", postId, updated.getOrThrow().status().value());

        return postRepository.findDetails(postId)
            .<Result<PostDetails, PostError>>map(Result::success)
            .orElseGet(() -> Result.failure(new PostError.PostNotFound(postId)));
    }

    @Override
    @Transactional
    public Result<Void, PostError> deletePost(Actor actor, UUID postId) {
        Optional<Post> existing = postRepository.findById(postId);
        if (existing.isEmpty()) {
            return Result.failure(new PostError.PostNotFound(postId));
        }
        if (!actor.canManage(existing.get().authorId())) {
            log.warn("Rejected delete of post {} by {}", postId, actor.userId());
            return Result.failure(new PostError.NotAuthorized("delete"));
        }

        commentRepository.deleteByPostId(postId);
        postRepository.delete(postId);

        log.info("Post deleted: id={}", postId);
        return Result.success(null);
    }

    @Override
    public Result<Page<PostDetails>, ValidationError> listPosts(PostFilter filter, PostSort sort, PageRequest pageRequest) {
        Instant now = clock.instant();
        try {
            List<PostDetails> posts = postRepository.findPublished(filter, sort, now, pageRequest.offset(), pageRequest.limit());
            return Result.success(Page.of(posts, pageRequest, postRepository.countPublished(filter, now)));
        } catch (SearchPatternRejectedException e) {
            log.warn("Post search rejected by database: {}", e.getPattern());
            return Result.failure(new ValidationError.InvalidSearchPattern(e.getPattern()));
        }
    }

    @Override
    public Result<PostView, PostError> getPost(Actor viewer, UUID postId) {
        Optional<PostDetails> found = postRepository.findDetails(postId);
        if (found.isEmpty() || !found.get().post().isVisibleTo(viewer)) {
            return Result.failure(new PostError.PostNotFound(postId));
        }
        PostDetails details = found.get();

        try {
            postRepository.incrementViews(postId);
            details = details.withViews(details.post().views() + 1);
        } catch (DataAccessException e) {
            // the read still succeeds; only the counter is lost
            log.warn("Failed to record view for post {}: {}", postId, e.getMessage());
        }

        List<CommentThread> comments = CommentThreads.assemble(
            commentRepository,
            commentRepository.findTopLevel(postId, CommentSort.NEWEST, 0, COMMENTS_ON_POST_PAGE)
        );
        return Result.success(new PostView(details, comments));
    }

    @Override
    public Result<Page<PostDetails>, PostError> getUserPosts(
            Actor viewer, UserId authorId, PostStatus status, PageRequest pageRequest) {
        PostStatus effective = status != null ? status : PostStatus.PUBLISHED;
        if (effective != PostStatus.PUBLISHED && !viewer.canManage(authorId)) {
            return Result.failure(new PostError.UnpublishedHidden(authorId));
        }
        List<PostDetails> posts = postRepository.findByAuthor(authorId, effective, pageRequest.offset(), pageRequest.limit());
        return Result.success(Page.of(posts, pageRequest, postRepository.countByAuthor(authorId, effective)));
    }

    @Override
    @Transactional
    public Result<LikeToggle, PostError> toggleLike(UserId userId, UUID postId) {
        if (postRepository.findById(postId).isEmpty()) {
            return Result.failure(new PostError.PostNotFound(postId));
        }

        boolean liked;
        if (postRepository.hasLike(postId, userId)) {
            postRepository.removeLike(postId, userId);
            liked = false;
        } else {
            postRepository.addLike(postId, userId, clock.instant());
            liked = true;
        }
        long likes = postRepository.countLikes(postId);

        log.debug("Post like toggled: post={}, user={}, liked={}", postId, userId, liked);
        return Result.success(new LikeToggle(liked, likes));
    }

    @Override
    public List<CategoryCount> getCategoryCounts() {
        return postRepository.countByCategory();
    }
}
