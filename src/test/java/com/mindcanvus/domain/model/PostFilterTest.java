package com.mindcanvus.domain.model;

import com.mindcanvus.domain.error.ValidationError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostFilterTest {

    @Test
    void shouldAcceptValidRegex() {
        var result = PostFilter.of(Category.TRAVEL, null, "  spring|java ");

        assertTrue(result.isSuccess());
        assertEquals("spring|java", result.getOrThrow().search());
    }

    @Test
    void shouldRejectInvalidRegex() {
        var result = PostFilter.of(null, null, "([");

        assertInstanceOf(ValidationError.InvalidSearchPattern.class, result.errorOrNull());
    }

    @Test
    void blankSearchShouldMeanNoSearch() {
        assertNull(PostFilter.of(null, null, "  ").getOrThrow().search());
    }

    @Test
    void categoryShouldParseLabelIgnoringCase() {
        assertEquals(Category.TECHNOLOGY, Category.parse("technology").getOrThrow());
        assertInstanceOf(ValidationError.PostContentError.InvalidCategory.class, Category.parse("Gardening").errorOrNull());
    }

    @Test
    void unknownSortShouldFallBackToLatest() {
        assertEquals(PostSort.LATEST, PostSort.fromParam("random"));
        assertEquals(PostSort.POPULAR, PostSort.fromParam("Popular"));
    }
}
