package com.mindcanvus.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageRequestTest {

    @Test
    void shouldApplyDefaultsForMissingValues() {
        PageRequest request = PageRequest.of(null, null, 10, 100);

        assertEquals(1, request.page());
        assertEquals(10, request.limit());
        assertEquals(0, request.offset());
    }

    @Test
    void shouldClampLimitToMaximum() {
        assertEquals(100, PageRequest.of(2, 500, 10, 100).limit());
    }

    @Test
    void shouldTreatNonPositivePageAsFirst() {
        assertEquals(1, PageRequest.of(0, 5, 10, 100).page());
    }

    @Test
    void hugePageShouldNotOverflowOffset() {
        PageRequest request = PageRequest.of(Integer.MAX_VALUE, 100, 10, 100);

        assertEquals(Integer.MAX_VALUE, request.offset());
    }

    @Test
    void offsetShouldSkipPreviousPages() {
        assertEquals(40, new PageRequest(3, 20).offset());
    }

    @Test
    void pageShouldComputeNavigation() {
        Page<String> page = Page.of(List.of("a", "b"), new PageRequest(2, 2), 5);

        assertEquals(3, page.pages());
        assertTrue(page.hasNext());
        assertTrue(page.hasPrev());
    }

    @Test
    void lastPageShouldHaveNoNext() {
        Page<String> page = Page.of(List.of("e"), new PageRequest(3, 2), 5);

        assertFalse(page.hasNext());
    }
}
