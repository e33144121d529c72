package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.MessageRepository;
import com.mindcanvus.domain.model.Conversation;
import com.mindcanvus.domain.model.Message;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcMessageRepository implements MessageRepository {

    private static final String MESSAGE_COLUMNS = "m.id, m.sender_id, m.recipient_id, m.content, m.read, m.read_at, m.created_at";

    private static final RowMapper<Message> ROW_MAPPER = (rs, rowNum) -> mapMessage(rs);

    private static final RowMapper<Conversation> CONVERSATION_ROW_MAPPER = (rs, rowNum) -> new Conversation(
        UserRows.map(rs, "counterpart_"),
        mapMessage(rs),
        rs.getLong("unread_count")
    );

    /*
     * The counterpart of a message is whichever side is not the user. Each partition
     * is one conversation: row 1 is its latest message, the windowed SUM its unread total.
     */
    private static final String CONVERSATIONS_SQL = """
        WITH mine AS (
            SELECT %s,
                   CASE WHEN m.sender_id = ? THEN m.recipient_id ELSE m.sender_id END AS counterpart_id
            FROM messages m
            WHERE m.sender_id = ? OR m.recipient_id = ?
        ), ranked AS (
            SELECT m.*,
                   ROW_NUMBER() OVER (PARTITION BY m.counterpart_id ORDER BY m.created_at DESC, m.id DESC) AS rn,
                   SUM(CASE WHEN m.recipient_id = ? AND m.read = FALSE THEN 1 ELSE 0 END)
                       OVER (PARTITION BY m.counterpart_id) AS unread_count
            FROM mine m
        )
        SELECT %s, m.unread_count, %s
        FROM ranked m
        JOIN users u ON u.id = m.counterpart_id
        WHERE m.rn = 1
        ORDER BY m.created_at DESC, m.id DESC
        """.formatted(MESSAGE_COLUMNS, MESSAGE_COLUMNS, UserRows.columns("u", "counterpart_"));

    private final JdbcTemplate jdbc;

    public JdbcMessageRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Message message) {
        jdbc.update("""
            INSERT INTO messages (id, sender_id, recipient_id, content, read, read_at, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            message.id(),
            message.senderId().value(),
            message.recipientId().value(),
            message.content(),
            message.read(),
            message.readAt() != null ? Timestamp.from(message.readAt()) : null,
            Timestamp.from(message.createdAt())
        );
    }

    @Override
    public List<Message> findConversation(UserId userId, UserId otherId, int offset, int limit) {
        return jdbc.query("""
            SELECT %s
            FROM messages m
            WHERE (m.sender_id = ? AND m.recipient_id = ?) OR (m.sender_id = ? AND m.recipient_id = ?)
            ORDER BY m.created_at DESC, m.id DESC
            LIMIT ? OFFSET ?
            """.formatted(MESSAGE_COLUMNS),
            ROW_MAPPER,
            userId.value(), otherId.value(),
            otherId.value(), userId.value(),
            limit,
            offset
        );
    }

    @Override
    public long countConversation(UserId userId, UserId otherId) {
        Long count = jdbc.queryForObject("""
            SELECT COUNT(*) FROM messages
            WHERE (sender_id = ? AND recipient_id = ?) OR (sender_id = ? AND recipient_id = ?)
            """,
            Long.class,
            userId.value(), otherId.value(),
            otherId.value(), userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public void markRead(List<UUID> messageIds, Instant readAt) {
        if (messageIds.isEmpty()) {
            return;
        }

        String placeholders = String.join(",", Collections.nCopies(messageIds.size(), "?"));
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(readAt));
        params.addAll(messageIds);

        jdbc.update(
            "UPDATE messages SET read = TRUE, read_at = ? WHERE read = FALSE AND id IN (" + placeholders + ")",
            params.toArray()
        );
    }

    @Override
    public int markConversationRead(UserId senderId, UserId recipientId, Instant readAt) {
        return jdbc.update("""
            UPDATE messages SET read = TRUE, read_at = ?
            WHERE sender_id = ? AND recipient_id = ? AND read = FALSE
            """,
            Timestamp.from(readAt),
            senderId.value(),
            recipientId.value()
        );
    }

    @Override
    public List<Conversation> findConversations(UserId userId) {
        UUID id = userId.value();
        return jdbc.query(CONVERSATIONS_SQL, CONVERSATION_ROW_MAPPER, id, id, id, id);
    }

    @Override
    public long countUnread(UserId recipientId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM messages WHERE recipient_id = ? AND read = FALSE",
            Long.class,
            recipientId.value()
        );
        return count != null ? count : 0;
    }

    private static Message mapMessage(ResultSet rs) throws SQLException {
        Timestamp readAt = rs.getTimestamp("read_at");
        return new Message(
            UUID.fromString(rs.getString("id")),
            UserId.fromTrusted(rs.getString("sender_id")),
            UserId.fromTrusted(rs.getString("recipient_id")),
            rs.getString("content"),
            rs.getBoolean("read"),
            readAt != null ? readAt.toInstant() : null,
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
