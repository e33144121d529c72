package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private static final String USER_COLUMNS = UserRows.columns("u", "");

    private static final RowMapper<User> ROW_MAPPER = UserRows.mapper("");

    private static final RowMapper<StoredCredentials> CREDENTIALS_ROW_MAPPER = (rs, rowNum) -> new StoredCredentials(
        UserRows.map(rs, ""),
        rs.getString("password_hash")
    );

    private final JdbcTemplate jdbc;

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(User user, String passwordHash) {
        jdbc.update("""
            INSERT INTO users (id, username, email, password_hash, first_name, last_name, bio, avatar, role, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            user.id().value(),
            user.username(),
            user.email(),
            passwordHash,
            user.firstName(),
            user.lastName(),
            user.bio(),
            user.avatar(),
            user.role().value(),
            Timestamp.from(user.createdAt())
        );
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query(
            "SELECT " + USER_COLUMNS + " FROM users u WHERE u.id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return jdbc.query(
            "SELECT " + USER_COLUMNS + " FROM users u WHERE u.username = ?",
            ROW_MAPPER,
            username
        ).stream().findFirst();
    }

    @Override
    public Optional<StoredCredentials> findCredentialsByEmail(String email) {
        return jdbc.query(
            "SELECT " + USER_COLUMNS + ", u.password_hash FROM users u WHERE u.email = ?",
            CREDENTIALS_ROW_MAPPER,
            email
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UserId id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            id.value()
        );
        return count != null && count > 0;
    }

    @Override
    public boolean existsByUsername(String username) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE username = ?",
            Integer.class,
            username
        );
        return count != null && count > 0;
    }

    @Override
    public boolean existsByEmail(String email) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE email = ?",
            Integer.class,
            email
        );
        return count != null && count > 0;
    }

    @Override
    public List<User> search(String pattern, int offset, int limit) {
        return RegexQueries.run(pattern, () -> jdbc.query("""
            SELECT %s
            FROM users u
            WHERE u.username ~* ? OR u.first_name ~* ? OR u.last_name ~* ?
            ORDER BY (SELECT COUNT(*) FROM follows f WHERE f.followee_id = u.id) DESC, u.username
            LIMIT ? OFFSET ?
            """.formatted(USER_COLUMNS),
            ROW_MAPPER,
            pattern, pattern, pattern,
            limit,
            offset
        ));
    }

    @Override
    public long countSearch(String pattern) {
        Long count = RegexQueries.run(pattern, () -> jdbc.queryForObject("""
            SELECT COUNT(*) FROM users u
            WHERE u.username ~* ? OR u.first_name ~* ? OR u.last_name ~* ?
            """,
            Long.class,
            pattern, pattern, pattern
        ));
        return count != null ? count : 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM users");
    }
}
