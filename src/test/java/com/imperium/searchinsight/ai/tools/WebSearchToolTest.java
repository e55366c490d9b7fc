package com.imperium.searchinsight.ai.tools;

import com.imperium.searchinsight.ai.orchestrator.SearchOrchestrator;
import com.imperium.searchinsight.exception.SearchValidationException;
import com.imperium.searchinsight.service.SearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebSearchToolTest {

    private SearchService searchService;
    private WebSearchTool tool;

    @BeforeEach
    void setUp() {
        searchService = mock(SearchService.class);
        SearchOrchestrator orchestrator = mock(SearchOrchestrator.class);
        when(orchestrator.getCallerTimeout()).thenReturn(Duration.ofSeconds(1));
        tool = new WebSearchTool(searchService, orchestrator);
    }

    @Test
    void returnsPlainTextAnswer() {
        when(searchService.searchTheWeb("capital of france", "123", "general")).thenReturn(Mono.just("Paris."));
        assertEquals("Paris.", tool.searchTheWeb("capital of france", "123", "general"));
    }

    @Test
    void validationFailureBecomesMessage() {
        when(searchService.searchTheWeb("", "123", null))
                .thenReturn(Mono.error(new SearchValidationException("query must not be blank", "query")));
        String out = tool.searchTheWeb("", "123", null);
        assertTrue(out.startsWith("Invalid search request"), out);
    }

    @Test
    void emptyAnswerOrFailureIsUnavailable() {
        when(searchService.searchTheWeb("a", null, null)).thenReturn(Mono.just(""));
        when(searchService.searchTheWeb("b", null, null)).thenReturn(Mono.never());
        assertEquals(WebSearchTool.UNAVAILABLE, tool.searchTheWeb("a", null, null));
        assertEquals(WebSearchTool.UNAVAILABLE, tool.searchTheWeb("b", null, null));
    }
}
