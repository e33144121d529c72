package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.domain.model.Category;
import com.mindcanvus.domain.model.CategoryCount;
import com.mindcanvus.domain.model.Post;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostFilter;
import com.mindcanvus.domain.model.PostSort;
import com.mindcanvus.domain.model.PostStatus;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcPostRepository implements PostRepository {

    private static final String POST_COLUMNS = """
        p.id, p.author_id, p.title, p.content, p.excerpt, p.category, p.status, p.scheduled_for,
        p.published_at, p.views, p.tags, p.featured_image, p.is_public, p.allow_comments,
        p.created_at, p.updated_at""";

    private static final String DETAILS_SELECT = """
        SELECT %s, %s,
               (SELECT COUNT(*) FROM post_likes pl WHERE pl.post_id = p.id) AS likes_count
        FROM posts p
        JOIN users a ON a.id = p.author_id
        """.formatted(POST_COLUMNS, UserRows.columns("a", "author_"));

    private static final String PUBLISHED = PostStatus.PUBLISHED.value();
    private static final String SCHEDULED = PostStatus.SCHEDULED.value();

    private static final RowMapper<Post> ROW_MAPPER = (rs, rowNum) -> mapPost(rs);

    private static final RowMapper<PostDetails> DETAILS_ROW_MAPPER = (rs, rowNum) -> new PostDetails(
        mapPost(rs),
        UserRows.map(rs, "author_"),
        rs.getLong("likes_count")
    );

    private final JdbcTemplate jdbc;

    public JdbcPostRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Post post) {
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO posts (id, author_id, title, content, excerpt, category, status, scheduled_for,
                                   published_at, views, tags, featured_image, is_public, allow_comments,
                                   created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """);
            ps.setObject(1, post.id());
            ps.setObject(2, post.authorId().value());
            ps.setString(3, post.title());
            ps.setString(4, post.content());
            ps.setString(5, post.excerpt());
            ps.setString(6, post.category().label());
            ps.setString(7, post.status().value());
            ps.setTimestamp(8, toTimestamp(post.scheduledFor()));
            ps.setTimestamp(9, toTimestamp(post.publishedAt()));
            ps.setLong(10, post.views());
            ps.setArray(11, con.createArrayOf("text", post.tags().toArray()));
            ps.setString(12, post.featuredImage());
            ps.setBoolean(13, post.isPublic());
            ps.setBoolean(14, post.allowComments());
            ps.setTimestamp(15, Timestamp.from(post.createdAt()));
            ps.setTimestamp(16, Timestamp.from(post.updatedAt()));
            return ps;
        });
    }

    /**
     * Writes every editable field. The view counter is left alone so concurrent reads are not lost.
     */
    @Override
    public void update(Post post) {
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                UPDATE posts
                SET title = ?, content = ?, excerpt = ?, category = ?, status = ?, scheduled_for = ?,
                    published_at = ?, tags = ?, featured_image = ?, is_public = ?, allow_comments = ?,
                    updated_at = ?
                WHERE id = ?
                """);
            ps.setString(1, post.title());
            ps.setString(2, post.content());
            ps.setString(3, post.excerpt());
            ps.setString(4, post.category().label());
            ps.setString(5, post.status().value());
            ps.setTimestamp(6, toTimestamp(post.scheduledFor()));
            ps.setTimestamp(7, toTimestamp(post.publishedAt()));
            ps.setArray(8, con.createArrayOf("text", post.tags().toArray()));
            ps.setString(9, post.featuredImage());
            ps.setBoolean(10, post.isPublic());
            ps.setBoolean(11, post.allowComments());
            ps.setTimestamp(12, Timestamp.from(post.updatedAt()));
            ps.setObject(13, post.id());
            return ps;
        });
    }

    @Override
    public Optional<Post> findById(UUID id) {
        return jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts p WHERE p.id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public Optional<PostDetails> findDetails(UUID id) {
        return jdbc.query(
            DETAILS_SELECT + "WHERE p.id = ?",
            DETAILS_ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public void delete(UUID id) {
        jdbc.update("DELETE FROM posts WHERE id = ?", id);
    }

    @Override
    public List<PostDetails> findPublished(PostFilter filter, PostSort sort, Instant now, int offset, int limit) {
        List<Object> params = new ArrayList<>();
        String where = publishedWhere(filter, now, params);
        params.add(limit);
        params.add(offset);
        return RegexQueries.run(filter.search(), () -> jdbc.query(
            DETAILS_SELECT + where + " ORDER BY " + orderBy(sort) + " LIMIT ? OFFSET ?",
            DETAILS_ROW_MAPPER,
            params.toArray()
        ));
    }

    @Override
    public long countPublished(PostFilter filter, Instant now) {
        List<Object> params = new ArrayList<>();
        String where = publishedWhere(filter, now, params);
        Long count = RegexQueries.run(filter.search(),
            () -> jdbc.queryForObject("SELECT COUNT(*) FROM posts p " + where, Long.class, params.toArray()));
        return count != null ? count : 0;
    }

    @Override
    public List<PostDetails> findByAuthor(UserId authorId, PostStatus status, int offset, int limit) {
        return jdbc.query(
            DETAILS_SELECT + """
                WHERE p.author_id = ? AND p.status = ?
                ORDER BY COALESCE(p.published_at, p.created_at) DESC, p.id DESC
                LIMIT ? OFFSET ?
                """,
            DETAILS_ROW_MAPPER,
            authorId.value(),
            status.value(),
            limit,
            offset
        );
    }

    @Override
    public long countByAuthor(UserId authorId, PostStatus status) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM posts WHERE author_id = ? AND status = ?",
            Long.class,
            authorId.value(),
            status.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public List<Post> findDueScheduled(Instant now) {
        return jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts p WHERE p.status = ? AND p.scheduled_for <= ? ORDER BY p.scheduled_for, p.id",
            ROW_MAPPER,
            SCHEDULED,
            Timestamp.from(now)
        );
    }

    @Override
    public boolean publishScheduled(UUID id, Instant now) {
        int updated = jdbc.update("""
            UPDATE posts
            SET status = ?, published_at = ?, updated_at = ?
            WHERE id = ? AND status = ?
            """,
            PUBLISHED,
            Timestamp.from(now),
            Timestamp.from(now),
            id,
            SCHEDULED
        );
        return updated == 1;
    }

    @Override
    public void incrementViews(UUID id) {
        jdbc.update("UPDATE posts SET views = views + 1 WHERE id = ?", id);
    }

    @Override
    public boolean hasLike(UUID postId, UserId userId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM post_likes WHERE post_id = ? AND user_id = ?",
            Integer.class,
            postId,
            userId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public void addLike(UUID postId, UserId userId, Instant now) {
        jdbc.update("""
            INSERT INTO post_likes (post_id, user_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (post_id, user_id) DO NOTHING
            """,
            postId,
            userId.value(),
            Timestamp.from(now)
        );
    }

    @Override
    public void removeLike(UUID postId, UserId userId) {
        jdbc.update("DELETE FROM post_likes WHERE post_id = ? AND user_id = ?", postId, userId.value());
    }

    @Override
    public long countLikes(UUID postId) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM post_likes WHERE post_id = ?", Long.class, postId);
        return count != null ? count : 0;
    }

    @Override
    public List<CategoryCount> countByCategory() {
        return jdbc.query("""
            SELECT category, COUNT(*) AS post_count
            FROM posts
            WHERE status = ?
            GROUP BY category
            ORDER BY post_count DESC, category
            """,
            (rs, rowNum) -> new CategoryCount(Category.fromLabel(rs.getString("category")), rs.getLong("post_count")),
            PUBLISHED
        );
    }

    @Override
    public long countPublishedByAuthor(UserId authorId) {
        return countByAuthor(authorId, PostStatus.PUBLISHED);
    }

    private static String publishedWhere(PostFilter filter, Instant now, List<Object> params) {
        StringBuilder where = new StringBuilder("WHERE p.status = ? AND p.published_at <= ?");
        params.add(PUBLISHED);
        params.add(Timestamp.from(now));
        if (filter.category() != null) {
            where.append(" AND p.category = ?");
            params.add(filter.category().label());
        }
        if (filter.authorId() != null) {
            where.append(" AND p.author_id = ?");
            params.add(filter.authorId().value());
        }
        if (filter.search() != null) {
            where.append(" AND (p.title ~* ? OR p.content ~* ? OR p.excerpt ~* ?)");
            params.add(filter.search());
            params.add(filter.search());
            params.add(filter.search());
        }
        return where.toString();
    }

    private static String orderBy(PostSort sort) {
        return switch (sort) {
            case LATEST -> "p.published_at DESC, p.id DESC";
            case OLDEST -> "p.published_at ASC, p.id ASC";
            case POPULAR -> "likes_count DESC, p.views DESC, p.published_at DESC";
            case VIEWS -> "p.views DESC, p.published_at DESC";
        };
    }

    private static Post mapPost(ResultSet rs) throws SQLException {
        return new Post(
            UUID.fromString(rs.getString("id")),
            UserId.fromTrusted(rs.getString("author_id")),
            rs.getString("title"),
            rs.getString("content"),
            rs.getString("excerpt"),
            Category.fromLabel(rs.getString("category")),
            PostStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("scheduled_for")),
            toInstant(rs.getTimestamp("published_at")),
            rs.getLong("views"),
            readTags(rs.getArray("tags")),
            rs.getString("featured_image"),
            rs.getBoolean("is_public"),
            rs.getBoolean("allow_comments"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private static List<String> readTags(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return Arrays.asList((String[]) array.getArray());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
