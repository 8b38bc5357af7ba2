package com.acme.learnlite.validation;

import com.acme.learnlite.common.Pagination;
import com.acme.learnlite.course.CourseDtos;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryParamsTest {

    @Test
    void defaultsWhenAbsent() {
        assertEquals(new Pagination(1, 10), QueryParams.validatePagination(Map.of()));
    }

    @Test
    void parsesStringsAndNumbers() {
        assertEquals(new Pagination(2, 20), QueryParams.validatePagination(Map.of("page", "2", "limit", "20")));
        assertEquals(new Pagination(3, 50), QueryParams.validatePagination(Map.of("page", 3, "limit", 50)));
    }

    @Test
    void clampsOutOfRangeValues() {
        assertEquals(new Pagination(1, 10), QueryParams.validatePagination(Map.of("page", "0", "limit", "0")));
        assertEquals(new Pagination(1, 10), QueryParams.validatePagination(Map.of("page", "-5", "limit", "101")));
        assertEquals(new Pagination(1, 100), QueryParams.validatePagination(Map.of("limit", "100")));
    }

    @Test
    void fallsBackOnUnparsableValues() {
        assertEquals(new Pagination(1, 10), QueryParams.validatePagination(Map.of("page", "invalid", "limit", "abc")));
    }

    @Test
    void offsetFollowsPageAndLimit() {
        assertEquals(40L, new Pagination(3, 20).offset());
    }

    @Test
    void sanitizeSearchTrimsAndDropsBlanks() {
        assertEquals("test search", QueryParams.sanitizeSearch("  test search  "));
        assertNull(QueryParams.sanitizeSearch("   "));
        assertNull(QueryParams.sanitizeSearch(""));
        assertNull(QueryParams.sanitizeSearch(null));
        assertNull(QueryParams.sanitizeSearch(123));
    }

    @Test
    void offsetOfFarPageDoesNotOverflow() {
        Pagination pagination = QueryParams.validatePagination(Map.of("page", "30000000", "limit", "100"));
        assertEquals(2_999_999_900L, pagination.offset());
        assertEquals(2_999_999_900L, new CourseDtos.CourseFilters(30_000_000, 100, null, true, null).offset());
    }
}
