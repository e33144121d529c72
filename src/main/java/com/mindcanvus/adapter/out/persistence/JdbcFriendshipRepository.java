package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.FriendshipRepository;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class JdbcFriendshipRepository implements FriendshipRepository {

    private static final String USER_COLUMNS = UserRows.columns("u", "");

    private static final RowMapper<User> USER_ROW_MAPPER = UserRows.mapper("");

    private final JdbcTemplate jdbc;

    public JdbcFriendshipRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean exists(UserId ownerId, UserId friendId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM friendships WHERE user_id = ? AND friend_id = ?",
            Integer.class,
            ownerId.value(),
            friendId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public void add(UserId ownerId, UserId friendId, Instant since) {
        jdbc.update("""
            INSERT INTO friendships (user_id, friend_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, friend_id) DO NOTHING
            """,
            ownerId.value(),
            friendId.value(),
            Timestamp.from(since)
        );
    }

    @Override
    public void remove(UserId ownerId, UserId friendId) {
        jdbc.update(
            "DELETE FROM friendships WHERE user_id = ? AND friend_id = ?",
            ownerId.value(),
            friendId.value()
        );
    }

    @Override
    public List<User> findFriends(UserId userId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s
            FROM friendships fr
            JOIN users u ON fr.friend_id = u.id
            WHERE fr.user_id = ?
            ORDER BY fr.created_at DESC, u.id
            LIMIT ? OFFSET ?
            """.formatted(USER_COLUMNS),
            USER_ROW_MAPPER,
            userId.value(),
            limit,
            offset
        );
    }

    @Override
    public long countFriends(UserId userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM friendships WHERE user_id = ?",
            Long.class,
            userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public List<User> findSuggestions(UserId userId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s
            FROM users u
            WHERE u.id <> ?
              AND NOT EXISTS (SELECT 1 FROM friendships fr WHERE fr.user_id = ? AND fr.friend_id = u.id)
            ORDER BY u.created_at DESC,
                     (SELECT COUNT(*) FROM follows f WHERE f.followee_id = u.id) DESC,
                     u.id
            LIMIT ? OFFSET ?
            """.formatted(USER_COLUMNS),
            USER_ROW_MAPPER,
            userId.value(),
            userId.value(),
            limit,
            offset
        );
    }

    @Override
    public long countSuggestions(UserId userId) {
        Long count = jdbc.queryForObject("""
            SELECT COUNT(*)
            FROM users u
            WHERE u.id <> ?
              AND NOT EXISTS (SELECT 1 FROM friendships fr WHERE fr.user_id = ? AND fr.friend_id = u.id)
            """,
            Long.class,
            userId.value(),
            userId.value()
        );
        return count != null ? count : 0;
    }
}
