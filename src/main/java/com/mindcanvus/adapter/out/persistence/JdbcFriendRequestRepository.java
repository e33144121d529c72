package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.FriendRequestRepository;
import com.mindcanvus.domain.model.FriendRequest;
import com.mindcanvus.domain.model.FriendRequestStatus;
import com.mindcanvus.domain.model.IncomingFriendRequest;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcFriendRequestRepository implements FriendRequestRepository {

    private static final String PENDING = FriendRequestStatus.PENDING.value();

    private static final RowMapper<FriendRequest> ROW_MAPPER = (rs, rowNum) -> mapRequest(rs);

    private static final RowMapper<IncomingFriendRequest> INCOMING_ROW_MAPPER = (rs, rowNum) -> new IncomingFriendRequest(
        mapRequest(rs),
        UserRows.map(rs, "from_")
    );

    private final JdbcTemplate jdbc;

    public JdbcFriendRequestRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(FriendRequest request) {
        jdbc.update("""
            INSERT INTO friend_requests (id, from_user_id, to_user_id, status, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            request.id(),
            request.fromUserId().value(),
            request.toUserId().value(),
            request.status().value(),
            Timestamp.from(request.createdAt())
        );
    }

    @Override
    public Optional<FriendRequest> findPending(UserId fromUserId, UserId toUserId) {
        return jdbc.query("""
            SELECT fr.id, fr.from_user_id, fr.to_user_id, fr.status, fr.created_at
            FROM friend_requests fr
            WHERE fr.from_user_id = ? AND fr.to_user_id = ? AND fr.status = ?
            """,
            ROW_MAPPER,
            fromUserId.value(),
            toUserId.value(),
            PENDING
        ).stream().findFirst();
    }

    @Override
    public int deleteByPair(UserId fromUserId, UserId toUserId) {
        return jdbc.update(
            "DELETE FROM friend_requests WHERE from_user_id = ? AND to_user_id = ?",
            fromUserId.value(),
            toUserId.value()
        );
    }

    @Override
    public List<IncomingFriendRequest> findIncoming(UserId toUserId, int offset, int limit) {
        return jdbc.query("""
            SELECT fr.id, fr.from_user_id, fr.to_user_id, fr.status, fr.created_at, %s
            FROM friend_requests fr
            JOIN users u ON fr.from_user_id = u.id
            WHERE fr.to_user_id = ? AND fr.status = ?
            ORDER BY fr.created_at, fr.id
            LIMIT ? OFFSET ?
            """.formatted(UserRows.columns("u", "from_")),
            INCOMING_ROW_MAPPER,
            toUserId.value(),
            PENDING,
            limit,
            offset
        );
    }

    @Override
    public long countIncoming(UserId toUserId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM friend_requests WHERE to_user_id = ? AND status = ?",
            Long.class,
            toUserId.value(),
            PENDING
        );
        return count != null ? count : 0;
    }

    @Override
    public List<User> findSentTo(UserId fromUserId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s
            FROM friend_requests fr
            JOIN users u ON fr.to_user_id = u.id
            WHERE fr.from_user_id = ? AND fr.status = ?
            ORDER BY fr.created_at, fr.id
            LIMIT ? OFFSET ?
            """.formatted(UserRows.columns("u", "")),
            UserRows.mapper(""),
            fromUserId.value(),
            PENDING,
            limit,
            offset
        );
    }

    @Override
    public long countSent(UserId fromUserId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM friend_requests WHERE from_user_id = ? AND status = ?",
            Long.class,
            fromUserId.value(),
            PENDING
        );
        return count != null ? count : 0;
    }

    private static FriendRequest mapRequest(ResultSet rs) throws SQLException {
        return new FriendRequest(
            UUID.fromString(rs.getString("id")),
            UserId.fromTrusted(rs.getString("from_user_id")),
            UserId.fromTrusted(rs.getString("to_user_id")),
            FriendRequestStatus.fromValue(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
