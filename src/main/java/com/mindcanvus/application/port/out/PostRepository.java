package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.CategoryCount;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostFilter;
import com.mindcanvus.domain.model.PostSort;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PostRepository {
    void save(Post post);
    void update(Post post);
    Optional<Post> findById(UUID id);
    Optional<PostDetails> findDetails(UUID id);
    void delete(UUID id);

    /**
     * Published posts whose publishedAt is not after {@code now}.
     *
     * @throws SearchPatternRejectedException if the database cannot compile the search pattern
     */
    List<PostDetails> findPublished(PostFilter filter, PostSort sort, Instant now, int offset, int limit);
    long countPublished(PostFilter filter, Instant now);

    List<PostDetails> findByAuthor(UserId authorId, PostStatus status, int offset, int limit);
    long countByAuthor(UserId authorId, PostStatus status);

    /**
     * Scheduled posts whose scheduledFor is at or before {@code now}, earliest first.
     */
    List<Post> findDueScheduled(Instant now);

    /**
     * Promotes a post to published if it is still scheduled.
     *
     * @return false when the post was no longer scheduled (someone else published or edited it)
     */
    boolean publishScheduled(UUID id, Instant now);

    void incrementViews(UUID id);

    boolean hasLike(UUID postId, UserId userId);
    void addLike(UUID postId, UserId userId, Instant now);
    void removeLike(UUID postId, UserId userId);
    long countLikes(UUID postId);

    /**
     * Published post counts per category, largest first.
     */
    List<CategoryCount> countByCategory();

    long countPublishedByAuthor(UserId authorId);
}
