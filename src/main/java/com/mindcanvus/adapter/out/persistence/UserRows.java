package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.domain.model.Role;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * User columns shared by every query that joins in a profile. A prefix keeps them apart
 * from the columns of the joined table.
 */
final class UserRows {

    private static final List<String> COLUMNS = List.of(
        "id", "username", "email", "first_name", "last_name", "bio", "avatar", "role", "created_at"
    );

    private UserRows() {}

    static String columns(String tableAlias, String prefix) {
        return COLUMNS.stream()
            .map(column -> tableAlias + "." + column + " AS " + prefix + column)
            .collect(Collectors.joining(", "));
    }

    static RowMapper<User> mapper(String prefix) {
        return (rs, rowNum) -> map(rs, prefix);
    }

    static User map(ResultSet rs, String prefix) throws SQLException {
        return new User(
            UserId.fromTrusted(rs.getString(prefix + "id")),
            rs.getString(prefix + "username"),
            rs.getString(prefix + "email"),
            rs.getString(prefix + "first_name"),
            rs.getString(prefix + "last_name"),
            rs.getString(prefix + "bio"),
            rs.getString(prefix + "avatar"),
            Role.fromValue(rs.getString(prefix + "role")),
            rs.getTimestamp(prefix + "created_at").toInstant()
        );
    }
}
