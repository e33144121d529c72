package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.PostContentError;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record Post(
    UUID id,
    UserId authorId,
    String title,
    String content,
    String excerpt,
    Category category,
    PostStatus status,
    Instant scheduledFor,
    Instant publishedAt,
    long views,
    List<String> tags,
    String featuredImage,
    boolean isPublic,
    boolean allowComments,
    Instant createdAt,
    Instant updatedAt
) {
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_CONTENT_LENGTH = 10000;
    public static final int MAX_EXCERPT_LENGTH = 500;
    static final int DERIVED_EXCERPT_LENGTH = 150;

    public Post {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Creates a post from author input. A scheduled post must carry a scheduledFor timestamp;
     * a timestamp already in the past is accepted and picked up by the next publisher tick.
     */
    public static Result<Post, PostContentError> create(UUID id, UserId authorId, PostDraft draft, Instant now) {
        PostStatus status = draft.status() != null ? draft.status() : PostStatus.DRAFT;
        if (draft.category() == null) {
            return Result.failure(PostContentError.MissingCategory.INSTANCE);
        }
        if (status == PostStatus.SCHEDULED && draft.scheduledFor() == null) {
            return Result.failure(PostContentError.MissingSchedule.INSTANCE);
        }
        Post post = new Post(
            id,
            authorId,
            trimOrNull(draft.title()),
            trimOrNull(draft.content()),
            excerptFor(draft.excerpt(), draft.content()),
            draft.category(),
            status,
            status == PostStatus.SCHEDULED ? draft.scheduledFor() : null,
            status == PostStatus.PUBLISHED ? now : null,
            0,
            cleanTags(draft.tags()),
            trimOrNull(draft.featuredImage()),
            draft.isPublic() == null || draft.isPublic(),
            draft.allowComments() == null || draft.allowComments(),
            now,
            now
        );
        return post.validate();
    }

    /**
     * Applies a partial update. Becoming published stamps publishedAt if it was never set;
     * becoming scheduled requires a scheduledFor, either new or already on the post.
     * Any other status clears scheduledFor.
     */
    public Result<Post, PostContentError> apply(PostChanges changes, Instant now) {
        PostStatus newStatus = changes.status() != null ? changes.status() : status;
        Instant newScheduledFor = null;
        if (newStatus == PostStatus.SCHEDULED) {
            newScheduledFor = changes.scheduledFor() != null ? changes.scheduledFor() : scheduledFor;
            if (newScheduledFor == null) {
                return Result.failure(PostContentError.MissingSchedule.INSTANCE);
            }
        }
        String newContent = changes.content() != null ? changes.content().trim() : content;
        String newExcerpt = changes.excerpt() != null ? excerptFor(changes.excerpt(), newContent) : excerpt;
        Instant newPublishedAt = newStatus == PostStatus.PUBLISHED && publishedAt == null ? now : publishedAt;

        Post updated = new Post(
            id,
            authorId,
            changes.title() != null ? changes.title().trim() : title,
            newContent,
            newExcerpt,
            changes.category() != null ? changes.category() : category,
            newStatus,
            newScheduledFor,
            newPublishedAt,
            views,
            changes.tags() != null ? cleanTags(changes.tags()) : tags,
            changes.featuredImage() != null ? trimOrNull(changes.featuredImage()) : featuredImage,
            changes.isPublic() != null ? changes.isPublic() : isPublic,
            changes.allowComments() != null ? changes.allowComments() : allowComments,
            createdAt,
            now
        );
        return updated.validate();
    }

    public boolean isPublished() {
        return status == PostStatus.PUBLISHED;
    }

    /**
     * Published posts are visible to everyone; drafts and scheduled posts only to their author or an admin.
     */
    public boolean isVisibleTo(Actor actor) {
        return isPublished() || actor.canManage(authorId);
    }

    public Post withViews(long newViews) {
        return new Post(id, authorId, title, content, excerpt, category, status, scheduledFor,
            publishedAt, newViews, tags, featuredImage, isPublic, allowComments, createdAt, updatedAt);
    }

    private Result<Post, PostContentError> validate() {
        if (title == null || title.isEmpty()) {
            return Result.failure(PostContentError.EmptyTitle.INSTANCE);
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            return Result.failure(new PostContentError.TitleTooLong(title.length(), MAX_TITLE_LENGTH));
        }
        if (content == null || content.isEmpty()) {
            return Result.failure(PostContentError.EmptyContent.INSTANCE);
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            return Result.failure(new PostContentError.ContentTooLong(content.length(), MAX_CONTENT_LENGTH));
        }
        if (excerpt != null && excerpt.length() > MAX_EXCERPT_LENGTH) {
            return Result.failure(new PostContentError.ExcerptTooLong(excerpt.length(), MAX_EXCERPT_LENGTH));
        }
        return Result.success(this);
    }

    private static String excerptFor(String excerpt, String content) {
        if (excerpt != null && !excerpt.isBlank()) {
            return excerpt.trim();
        }
        if (content == null || content.isBlank()) {
            return null;
        }
        String trimmed = content.trim();
        return trimmed.length() <= DERIVED_EXCERPT_LENGTH
            ? trimmed
            : trimmed.substring(0, DERIVED_EXCERPT_LENGTH) + "...";
    }

    private static List<String> cleanTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(tag -> !tag.isEmpty())
            .distinct()
            .toList();
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }
}
