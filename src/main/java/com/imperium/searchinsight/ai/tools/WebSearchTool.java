package com.imperium.searchinsight.ai.tools;

import com.imperium.searchinsight.ai.orchestrator.SearchOrchestrator;
import com.imperium.searchinsight.exception.SearchValidationException;
import com.imperium.searchinsight.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Spring AI Tool: web search for the assistant, legacy search_the_web contract.
 */
@Component
public class WebSearchTool {

    private static final Logger log = LoggerFactory.getLogger(WebSearchTool.class);

    static final String UNAVAILABLE = "Search is temporarily unavailable.";

    private final SearchService searchService;
    private final Duration blockTimeout;

    public WebSearchTool(SearchService searchService, SearchOrchestrator orchestrator) {
        this.searchService = searchService;
        // 编排器自身保证在调用方超时内返回，这里多留一点余量
        this.blockTimeout = orchestrator.getCallerTimeout().plusSeconds(2);
    }

    @Tool(name = "search_the_web",
            description = "Search the web for current information and return a short plain-text answer. "
                    + "Use searchType 'news' for recent events, 'image' for pictures, otherwise 'general'.")
    public String searchTheWeb(
            @ToolParam(description = "Search query, a short natural-language question or keywords") String query,
            @ToolParam(description = "Identifier of the user asking", required = false) String requesterId,
            @ToolParam(description = "general | news | image", required = false) String searchType) {
        try {
            String answer = searchService.searchTheWeb(query, requesterId, searchType).block(blockTimeout);
            return answer != null && !answer.isBlank() ? answer : UNAVAILABLE;
        } catch (SearchValidationException e) {
            return "Invalid search request: " + e.getMessage();
        } catch (RuntimeException e) {
            log.warn("search_the_web tool failed: {}", e.getMessage());
            return UNAVAILABLE;
        }
    }
}
