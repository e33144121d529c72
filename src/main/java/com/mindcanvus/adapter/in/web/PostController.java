package com.mindcanvus.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mindcanvus.application.port.in.CreatePostUseCase;
import com.mindcanvus.application.port.in.DeletePostUseCase;
import com.mindcanvus.application.port.in.GetCategoryCountsUseCase;
import com.mindcanvus.application.port.in.GetPostUseCase;
import com.mindcanvus.application.port.in.GetUserPostsUseCase;
import com.mindcanvus.application.port.in.ListPostsUseCase;
import com.mindcanvus.application.port.in.TogglePostLikeUseCase;
import com.mindcanvus.application.port.in.UpdatePostUseCase;
import com.mindcanvus.domain.error.PostError;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.error.ValidationError.PostContentError;
import com.mindcanvus.domain.model.Category;
import com.mindcanvus.domain.model.LikeToggle;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PostChanges;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostDraft;
import com.mindcanvus.domain.model.PostFilter;
import com.mindcanvus.domain.model.PostSort;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.PostView;
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

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/posts")
@Tag(name = "Posts", description = "Blog posts, likes and categories")
public class PostController {

    private final CreatePostUseCase createPostUseCase;
    private final UpdatePostUseCase updatePostUseCase;
    private final DeletePostUseCase deletePostUseCase;
    private final ListPostsUseCase listPostsUseCase;
    private final GetPostUseCase getPostUseCase;
    private final GetUserPostsUseCase getUserPostsUseCase;
    private final TogglePostLikeUseCase togglePostLikeUseCase;
    private final GetCategoryCountsUseCase getCategoryCountsUseCase;
    private final AppProperties appProperties;

    public PostController(
            CreatePostUseCase createPostUseCase,
            UpdatePostUseCase updatePostUseCase,
            DeletePostUseCase deletePostUseCase,
            ListPostsUseCase listPostsUseCase,
            GetPostUseCase getPostUseCase,
            GetUserPostsUseCase getUserPostsUseCase,
            TogglePostLikeUseCase togglePostLikeUseCase,
            GetCategoryCountsUseCase getCategoryCountsUseCase,
            AppProperties appProperties) {
        this.createPostUseCase = createPostUseCase;
        this.updatePostUseCase = updatePostUseCase;
        this.deletePostUseCase = deletePostUseCase;
        this.listPostsUseCase = listPostsUseCase;
        this.getPostUseCase = getPostUseCase;
        this.getUserPostsUseCase = getUserPostsUseCase;
        this.togglePostLikeUseCase = togglePostLikeUseCase;
        this.getCategoryCountsUseCase = getCategoryCountsUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping
    @Operation(summary = "List published posts", description = "Filters by category, author and a case-insensitive regex over title, content and excerpt")
    public ResponseEntity<?> listPosts(
            @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size (capped by app.pagination.max-limit)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Category label", example = "Technology")
            @RequestParam(required = false) String category,
            @Parameter(description = "Author user ID")
            @RequestParam(required = false) String author,
            @Parameter(description = "Regular expression", example = "spring|java")
            @RequestParam(required = false) String search,
            @Parameter(description = "latest, oldest, popular or views")
            @RequestParam(required = false) String sort) {

        Category categoryFilter = null;
        if (category != null && !category.isBlank()) {
            var categoryResult = Category.parse(category);
            if (categoryResult.isFailure()) {
                return ErrorResponses.of(categoryResult.errorOrNull());
            }
            categoryFilter = categoryResult.getOrThrow();
        }

        UserId authorFilter = null;
        if (author != null && !author.isBlank()) {
            var authorResult = UserId.parse(author);
            if (authorResult.isFailure()) {
                return ErrorResponses.of(authorResult.errorOrNull());
            }
            authorFilter = authorResult.getOrThrow();
        }

        Result<PostFilter, ValidationError> filter = PostFilter.of(categoryFilter, authorFilter, search);
        if (filter.isFailure()) {
            return ErrorResponses.of(filter.errorOrNull());
        }

        Result<Page<PostDetails>, ValidationError> posts = listPostsUseCase.listPosts(
            filter.getOrThrow(), PostSort.fromParam(sort), Paging.of(page, limit, appProperties));

        return posts.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(posts.getOrThrow(), PostResponse::from))
            : ErrorResponses.of(posts.errorOrNull());
    }

    @GetMapping("/categories")
    @Operation(summary = "Category counts", description = "Number of published posts per category, most used first")
    public List<CategoryCountResponse> categories() {
        return getCategoryCountsUseCase.getCategoryCounts().stream()
            .map(c -> new CategoryCountResponse(c.category().label(), c.count()))
            .toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Open a post", description = "Returns the post with its first comment threads and counts the view")
    public ResponseEntity<?> getPost(@PathVariable UUID id) {
        Result<PostView, PostError> result = getPostUseCase.getPost(RequestContext.getActor(), id);

        return result.isSuccess()
            ? ResponseEntity.ok(PostViewResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "Posts by author", description = "Published posts by default; drafts only for the author or an admin")
    public ResponseEntity<?> getUserPosts(
            @Parameter(description = "Author user ID", example = "550e8400-e29b-41d4-a716-446655440000")
            @PathVariable String userId,
            @Parameter(description = "published, draft or scheduled")
            @RequestParam(defaultValue = "published") String status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return ErrorResponses.of(userIdResult.errorOrNull());
        }
        var statusResult = PostStatus.parse(status);
        if (statusResult.isFailure()) {
            return ErrorResponses.of(statusResult.errorOrNull());
        }

        Result<Page<PostDetails>, PostError> result = getUserPostsUseCase.getUserPosts(
            RequestContext.getActor(), userIdResult.getOrThrow(), statusResult.getOrThrow(),
            Paging.of(page, limit, appProperties));

        return result.isSuccess()
            ? ResponseEntity.ok(PageResponse.from(result.getOrThrow(), PostResponse::from))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping
    @Operation(summary = "Create a post", description = "Status defaults to draft; scheduled posts need scheduledFor")
    public ResponseEntity<?> createPost(@Valid @RequestBody CreatePostRequest request) {
        var categoryResult = Category.parse(request.category());
        if (categoryResult.isFailure()) {
            return ErrorResponses.of(categoryResult.errorOrNull());
        }
        Result<PostStatus, PostContentError> statusResult = parseOptionalStatus(request.status());
        if (statusResult.isFailure()) {
            return ErrorResponses.of(statusResult.errorOrNull());
        }

        PostDraft draft = new PostDraft(
            request.title(),
            request.content(),
            request.excerpt(),
            categoryResult.getOrThrow(),
            statusResult.getOrThrow(),
            request.scheduledFor(),
            request.tags(),
            request.featuredImage(),
            request.isPublic(),
            request.allowComments()
        );
        Result<PostDetails, PostError> result = createPostUseCase.createPost(RequestContext.getUserId(), draft);

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(PostResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a post", description = "Partial update by the author or an admin")
    public ResponseEntity<?> updatePost(@PathVariable UUID id, @RequestBody UpdatePostRequest request) {
        Category category = null;
        if (request.category() != null) {
            var categoryResult = Category.parse(request.category());
            if (categoryResult.isFailure()) {
                return ErrorResponses.of(categoryResult.errorOrNull());
            }
            category = categoryResult.getOrThrow();
        }
        Result<PostStatus, PostContentError> statusResult = parseOptionalStatus(request.status());
        if (statusResult.isFailure()) {
            return ErrorResponses.of(statusResult.errorOrNull());
        }

        PostChanges changes = new PostChanges(
            request.title(),
            request.content(),
            request.excerpt(),
            category,
            statusResult.getOrThrow(),
            request.scheduledFor(),
            request.tags(),
            request.featuredImage(),
            request.isPublic(),
            request.allowComments()
        );
        Result<PostDetails, PostError> result = updatePostUseCase.updatePost(RequestContext.getActor(), id, changes);

        return result.isSuccess()
            ? ResponseEntity.ok(PostResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a post", description = "Removes the post with its comments and likes")
    public ResponseEntity<?> deletePost(@PathVariable UUID id) {
        Result<Void, PostError> result = deletePostUseCase.deletePost(RequestContext.getActor(), id);

        return result.isSuccess()
            ? ResponseEntity.ok(new StatusResponse("Post deleted successfully"))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping("/{id}/like")
    @Operation(summary = "Like or unlike a post")
    public ResponseEntity<?> toggleLike(@PathVariable UUID id) {
        Result<LikeToggle, PostError> result = togglePostLikeUseCase.toggleLike(RequestContext.getUserId(), id);

        return result.isSuccess()
            ? ResponseEntity.ok(LikeResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    private static Result<PostStatus, PostContentError> parseOptionalStatus(String status) {
        return status == null ? Result.success(null) : PostStatus.parse(status);
    }

    public record CreatePostRequest(
        @NotBlank String title,
        @NotBlank String content,
        String excerpt,
        @NotBlank String category,
        String status,
        Instant scheduledFor,
        List<String> tags,
        String featuredImage,
        @JsonProperty("isPublic") Boolean isPublic,
        Boolean allowComments
    ) {}

    public record UpdatePostRequest(
        String title,
        String content,
        String excerpt,
        String category,
        String status,
        Instant scheduledFor,
        List<String> tags,
        String featuredImage,
        @JsonProperty("isPublic") Boolean isPublic,
        Boolean allowComments
    ) {}

    public record CategoryCountResponse(String category, long count) {}

    public record PostViewResponse(PostResponse post, List<CommentResponse> comments) {
        static PostViewResponse from(PostView view) {
            return new PostViewResponse(
                PostResponse.from(view.details()),
                view.comments().stream().map(CommentResponse::from).toList()
            );
        }
    }
}
