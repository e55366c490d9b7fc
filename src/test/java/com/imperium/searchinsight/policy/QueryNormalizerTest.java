package com.imperium.searchinsight.policy;

import com.imperium.searchinsight.exception.SearchValidationException;
import com.imperium.searchinsight.model.SearchDepth;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.model.SearchType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryNormalizerTest {

    @Test
    void collapsesWhitespaceAndKeepsCase() {
        SearchQuery q = QueryNormalizer.normalize(SearchQuery.builder().text("  Today's   India\nNews ").build());
        assertEquals("Today's India News", q.getText());
        assertEquals(QueryNormalizer.ANONYMOUS, q.getRequesterId());
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(SearchValidationException.class, () -> QueryNormalizer.normalize(null));
        assertThrows(SearchValidationException.class,
                () -> QueryNormalizer.normalize(SearchQuery.builder().text(" \t ").build()));
        SearchValidationException e = assertThrows(SearchValidationException.class,
                () -> QueryNormalizer.normalize(SearchQuery.builder().text("x")
                        .params(SearchParams.builder().days(0).build()).build()));
        assertEquals("days", e.getField());
    }

    @Test
    void appliesTypePolicy() {
        SearchQuery news = QueryNormalizer.normalize(SearchQuery.builder().text("x").type(SearchType.NEWS).build());
        assertEquals(SearchDepth.ADVANCED, news.getParams().getDepth());

        SearchQuery image = QueryNormalizer.normalize(SearchQuery.builder().text("x").type(SearchType.IMAGE).build());
        assertTrue(image.getParams().isIncludeImages());

        SearchQuery many = QueryNormalizer.normalize(SearchQuery.builder().text("x")
                .params(SearchParams.builder().maxResults(99).build()).build());
        assertEquals(SearchTypePolicy.MAX_RESULTS_CAP, many.getParams().getMaxResults());
    }

    @Test
    void normalizesDomainsAndLanguage() {
        SearchQuery q = QueryNormalizer.normalize(SearchQuery.builder().text("x")
                .params(SearchParams.builder()
                        .excludeDomains(new LinkedHashSet<>(List.of(" Z.com", "a.COM", "")))
                        .language("EN")
                        .build())
                .build());
        assertEquals(List.of("a.com", "z.com"), List.copyOf(q.getParams().getExcludeDomains()));
        assertEquals("en", q.getParams().getLanguage());
    }

    @Test
    void ttlDependsOnType() {
        CacheTtlPolicy policy = new CacheTtlPolicy(600, 300, 900);
        assertEquals(Duration.ofSeconds(600), policy.ttlFor(SearchType.GENERAL));
        assertEquals(Duration.ofSeconds(300), policy.ttlFor(SearchType.NEWS));
        assertEquals(Duration.ofSeconds(900), policy.ttlFor(SearchType.IMAGE));
    }
}
