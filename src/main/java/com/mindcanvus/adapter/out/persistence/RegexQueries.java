package com.mindcanvus.adapter.out.persistence;

import com.mindcanvus.application.port.out.SearchPatternRejectedException;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Runs a query that feeds a user pattern to PostgreSQL's {@code ~*}, turning
 * {@code invalid_regular_expression} into {@link SearchPatternRejectedException}.
 */
final class RegexQueries {

    static final String INVALID_REGULAR_EXPRESSION = "2201B";

    private RegexQueries() {}

    static <T> T run(String pattern, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            if (isInvalidRegex(e)) {
                throw new SearchPatternRejectedException(pattern, e);
            }
            throw e;
        }
    }

    static boolean isInvalidRegex(DataAccessException e) {
        return e.getMostSpecificCause() instanceof SQLException sql
            && INVALID_REGULAR_EXPRESSION.equals(sql.getSQLState());
    }
}
