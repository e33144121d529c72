package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError.CommentContentError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CommentTest {

    private static final UserId AUTHOR = UserId.random();
    private static final UUID POST_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldCreateTopLevelComment() {
        var result = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "  Nice post  ", null, NOW);

        assertTrue(result.isSuccess());
        Comment comment = result.getOrThrow();
        assertEquals("Nice post", comment.content());
        assertNull(comment.parentId());
        assertFalse(comment.isEdited());
        assertFalse(comment.isDeleted());
    }

    @Test
    void shouldCreateReplyToTopLevelComment() {
        Comment parent = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Parent", null, NOW).getOrThrow();

        Comment reply = Comment.create(UUID.randomUUID(), POST_ID, UserId.random(), "Reply", parent, NOW).getOrThrow();

        assertEquals(parent.id(), reply.parentId());
        assertTrue(reply.isReply());
    }

    @Test
    void shouldRejectReplyToReply() {
        Comment parent = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Parent", null, NOW).getOrThrow();
        Comment reply = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Reply", parent, NOW).getOrThrow();

        var result = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Nested", reply, NOW);

        assertInstanceOf(CommentContentError.NestedReply.class, result.errorOrNull());
    }

    @Test
    void shouldRejectParentOnAnotherPost() {
        Comment parent = Comment.create(UUID.randomUUID(), UUID.randomUUID(), AUTHOR, "Elsewhere", null, NOW).getOrThrow();

        var result = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Reply", parent, NOW);

        assertInstanceOf(CommentContentError.ParentOnOtherPost.class, result.errorOrNull());
    }

    @Test
    void shouldFailWithBlankContent() {
        var result = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "   ", null, NOW);
        assertInstanceOf(CommentContentError.EmptyContent.class, result.errorOrNull());
    }

    @Test
    void shouldFailWithContentExceeding1000Characters() {
        var result = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "a".repeat(1001), null, NOW);
        assertInstanceOf(CommentContentError.ContentTooLong.class, result.errorOrNull());
    }

    @Test
    void editShouldMarkCommentAsEdited() {
        Comment comment = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Before", null, NOW).getOrThrow();
        Instant later = NOW.plusSeconds(5);

        Comment edited = comment.edit("After", later).getOrThrow();

        assertEquals("After", edited.content());
        assertTrue(edited.isEdited());
        assertEquals(later, edited.editedAt());
    }

    @Test
    void softDeleteShouldReplaceContent() {
        Comment comment = Comment.create(UUID.randomUUID(), POST_ID, AUTHOR, "Secret", null, NOW).getOrThrow();

        Comment deleted = comment.softDelete(NOW);

        assertTrue(deleted.isDeleted());
        assertEquals(Comment.DELETED_PLACEHOLDER, deleted.content());
        assertEquals(comment.id(), deleted.id());
    }
}
