package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.CommentRepository;
import com.mindcanvus.domain.model.Comment;
import com.mindcanvus.domain.model.CommentDetails;
import com.mindcanvus.domain.model.CommentSort;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcCommentRepository implements CommentRepository {

    private static final String COMMENT_COLUMNS =
        "c.id, c.post_id, c.author_id, c.content, c.parent_id, c.is_edited, c.edited_at, c.is_deleted, c.created_at, c.updated_at";

    private static final String DETAILS_SELECT = """
        SELECT %s, %s,
               (SELECT COUNT(*) FROM comment_likes cl WHERE cl.comment_id = c.id) AS likes_count
        FROM comments c
        JOIN users a ON a.id = c.author_id
        """.formatted(COMMENT_COLUMNS, UserRows.columns("a", "author_"));

    private static final RowMapper<Comment> ROW_MAPPER = (rs, rowNum) -> mapComment(rs);

    private static final RowMapper<CommentDetails> DETAILS_ROW_MAPPER = (rs, rowNum) -> new CommentDetails(
        mapComment(rs),
        UserRows.map(rs, "author_"),
        rs.getLong("likes_count")
    );

    private final JdbcTemplate jdbc;

    public JdbcCommentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Comment comment) {
        jdbc.update("""
            INSERT INTO comments (id, post_id, author_id, content, parent_id, is_edited, edited_at, is_deleted,
                                  created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            comment.id(),
            comment.postId(),
            comment.authorId().value(),
            comment.content(),
            comment.parentId(),
            comment.isEdited(),
            toTimestamp(comment.editedAt()),
            comment.isDeleted(),
            Timestamp.from(comment.createdAt()),
            Timestamp.from(comment.updatedAt())
        );
    }

    @Override
    public void update(Comment comment) {
        jdbc.update("""
            UPDATE comments
            SET content = ?, is_edited = ?, edited_at = ?, is_deleted = ?, updated_at = ?
            WHERE id = ?
            """,
            comment.content(),
            comment.isEdited(),
            toTimestamp(comment.editedAt()),
            comment.isDeleted(),
            Timestamp.from(comment.updatedAt()),
            comment.id()
        );
    }

    @Override
    public Optional<Comment> findById(UUID id) {
        return jdbc.query(
            "SELECT " + COMMENT_COLUMNS + " FROM comments c WHERE c.id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public List<CommentDetails> findTopLevel(UUID postId, CommentSort sort, int offset, int limit) {
        String order = sort == CommentSort.OLDEST ? "c.created_at ASC, c.id ASC" : "c.created_at DESC, c.id DESC";
        return jdbc.query(
            DETAILS_SELECT + """
                WHERE c.post_id = ? AND c.parent_id IS NULL AND c.is_deleted = FALSE
                ORDER BY %s
                LIMIT ? OFFSET ?
                """.formatted(order),
            DETAILS_ROW_MAPPER,
            postId,
            limit,
            offset
        );
    }

    @Override
    public long countTopLevel(UUID postId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM comments WHERE post_id = ? AND parent_id IS NULL AND is_deleted = FALSE",
            Long.class,
            postId
        );
        return count != null ? count : 0;
    }

    @Override
    public List<CommentDetails> findRepliesOf(List<UUID> parentIds) {
        if (parentIds.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(",", Collections.nCopies(parentIds.size(), "?"));
        String sql = DETAILS_SELECT
            + "WHERE c.parent_id IN (" + placeholders + ") AND c.is_deleted = FALSE "
            + "ORDER BY c.created_at ASC, c.id ASC";

        return jdbc.query(sql, DETAILS_ROW_MAPPER, parentIds.toArray());
    }

    @Override
    public List<CommentDetails> findReplies(UUID parentId, int offset, int limit) {
        return jdbc.query(
            DETAILS_SELECT + """
                WHERE c.parent_id = ? AND c.is_deleted = FALSE
                ORDER BY c.created_at ASC, c.id ASC
                LIMIT ? OFFSET ?
                """,
            DETAILS_ROW_MAPPER,
            parentId,
            limit,
            offset
        );
    }

    @Override
    public long countReplies(UUID parentId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM comments WHERE parent_id = ? AND is_deleted = FALSE",
            Long.class,
            parentId
        );
        return count != null ? count : 0;
    }

    @Override
    public void deleteByPostId(UUID postId) {
        jdbc.update("DELETE FROM comments WHERE post_id = ?", postId);
    }

    @Override
    public boolean hasLike(UUID commentId, UserId userId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM comment_likes WHERE comment_id = ? AND user_id = ?",
            Integer.class,
            commentId,
            userId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public void addLike(UUID commentId, UserId userId, Instant now) {
        jdbc.update("""
            INSERT INTO comment_likes (comment_id, user_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (comment_id, user_id) DO NOTHING
            """,
            commentId,
            userId.value(),
            Timestamp.from(now)
        );
    }

    @Override
    public void removeLike(UUID commentId, UserId userId) {
        jdbc.update("DELETE FROM comment_likes WHERE comment_id = ? AND user_id = ?", commentId, userId.value());
    }

    @Override
    public long countLikes(UUID commentId) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM comment_likes WHERE comment_id = ?", Long.class, commentId);
        return count != null ? count : 0;
    }

    private static Comment mapComment(ResultSet rs) throws SQLException {
        String parentId = rs.getString("parent_id");
        Timestamp editedAt = rs.getTimestamp("edited_at");
        return new Comment(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("post_id")),
            UserId.fromTrusted(rs.getString("author_id")),
            rs.getString("content"),
            parentId != null ? UUID.fromString(parentId) : null,
            rs.getBoolean("is_edited"),
            editedAt != null ? editedAt.toInstant() : null,
            rs.getBoolean("is_deleted"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
