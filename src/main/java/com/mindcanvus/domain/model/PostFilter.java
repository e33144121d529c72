package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Criteria for the public post listing. Every field is optional.
 *
 * @param search case-insensitive regular expression matched against title, content and excerpt
 */
public record PostFilter(Category category, UserId authorId, String search) {

    public static final PostFilter NONE = new PostFilter(null, null, null);

    public static Result<PostFilter, ValidationError> of(Category category, UserId authorId, String search) {
        String trimmed = search == null || search.isBlank() ? null : search.trim();
        if (trimmed != null) {
            try {
                Pattern.compile(trimmed);
            } catch (PatternSyntaxException e) {
                return Result.failure(new ValidationError.InvalidSearchPattern(trimmed));
            }
        }
        return Result.success(new PostFilter(category, authorId, trimmed));
    }
}
