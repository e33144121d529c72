package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.domain.model.Follow;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcFollowRepository implements FollowRepository {

    private static final String USER_COLUMNS = UserRows.columns("u", "");

    private static final RowMapper<FollowedUser> FOLLOWED_USER_ROW_MAPPER = (rs, rowNum) -> new FollowedUser(
        UserRows.map(rs, ""),
        rs.getTimestamp("followed_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcFollowRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Follow follow) {
        jdbc.update("""
            INSERT INTO follows (follower_id, followee_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (follower_id, followee_id) DO NOTHING
            """,
            follow.followerId().value(),
            follow.followeeId().value(),
            Timestamp.from(follow.createdAt())
        );
    }

    @Override
    public void delete(UserId followerId, UserId followeeId) {
        jdbc.update(
            "DELETE FROM follows WHERE follower_id = ? AND followee_id = ?",
            followerId.value(),
            followeeId.value()
        );
    }

    @Override
    public boolean exists(UserId followerId, UserId followeeId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE follower_id = ? AND followee_id = ?",
            Integer.class,
            followerId.value(),
            followeeId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public List<FollowedUser> findFollowing(UserId userId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s, f.created_at AS followed_at
            FROM follows f
            JOIN users u ON f.followee_id = u.id
            WHERE f.follower_id = ?
            ORDER BY f.created_at DESC
            LIMIT ? OFFSET ?
            """.formatted(USER_COLUMNS),
            FOLLOWED_USER_ROW_MAPPER,
            userId.value(),
            limit,
            offset
        );
    }

    @Override
    public List<FollowedUser> findFollowers(UserId userId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s, f.created_at AS followed_at
            FROM follows f
            JOIN users u ON f.follower_id = u.id
            WHERE f.followee_id = ?
            ORDER BY f.created_at DESC
            LIMIT ? OFFSET ?
            """.formatted(USER_COLUMNS),
            FOLLOWED_USER_ROW_MAPPER,
            userId.value(),
            limit,
            offset
        );
    }

    @Override
    public long countFollowers(UserId userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE followee_id = ?",
            Long.class,
            userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public long countFollowing(UserId userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE follower_id = ?",
            Long.class,
            userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public List<User> findSuggestions(UserId userId, int limit) {
        return jdbc.query("""
            SELECT %s
            FROM users u
            WHERE u.id <> ?
              AND NOT EXISTS (SELECT 1 FROM follows f WHERE f.follower_id = ? AND f.followee_id = u.id)
              AND NOT EXISTS (SELECT 1 FROM friendships fr WHERE fr.user_id = ? AND fr.friend_id = u.id)
            ORDER BY (SELECT COUNT(*) FROM follows f2 WHERE f2.followee_id = u.id) DESC, u.created_at DESC
            LIMIT ?
            """.formatted(USER_COLUMNS),
            UserRows.mapper(""),
            userId.value(),
            userId.value(),
            userId.value(),
            limit
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follows", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM follows");
    }
}
