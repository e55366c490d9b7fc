package com.imperium.searchinsight.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.searchinsight.exception.SearchValidationException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchParamsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void defaults() {
        SearchParams p = SearchParams.defaults();
        assertEquals(SearchDepth.BASIC, p.getDepth());
        assertEquals(10, p.getMaxResults());
        assertEquals("en", p.getLanguage());
        assertNull(p.getDays());
        assertFalse(p.isIncludeImages());
        assertTrue(p.getIncludeDomains().isEmpty());
    }

    @Test
    void readsTypedFields() throws Exception {
        SearchParams p = objectMapper.readValue("""
                {"depth":"advanced","maxResults":3,"includeDomains":["a.com"],"days":2,"language":"de"}
                """, SearchParams.class);
        assertEquals(SearchDepth.ADVANCED, p.getDepth());
        assertEquals(3, p.getMaxResults());
        assertEquals(Set.of("a.com"), p.getIncludeDomains());
        assertEquals(2, p.getDays());
        assertEquals("de", p.getLanguage());
    }

    @Test
    void unknownKeyIsConfigurationError() {
        Exception e = assertThrows(Exception.class,
                () -> objectMapper.readValue("{\"safeSearch\":true}", SearchParams.class));
        Throwable cause = e;
        while (cause != null && !(cause instanceof SearchValidationException)) {
            cause = cause.getCause();
        }
        assertTrue(cause instanceof SearchValidationException, String.valueOf(e));
        assertEquals("unknown configuration key: safeSearch", cause.getMessage());
        assertEquals("safeSearch", ((SearchValidationException) cause).getField());
    }

    @Test
    void unknownDepthIsRejected() {
        assertThrows(Exception.class, () -> objectMapper.readValue("{\"depth\":\"deep\"}", SearchParams.class));
        assertThrows(SearchValidationException.class, () -> SearchType.fromValue("video"));
        assertEquals(SearchType.GENERAL, SearchType.fromValue(" "));
        assertEquals(SearchType.NEWS, SearchType.fromValue("NEWS"));
    }
}
