package com.imperium.searchinsight.controller;

import com.imperium.searchinsight.model.dto.request.SearchRequest;
import com.imperium.searchinsight.model.dto.response.EnhancedSearchResult;
import com.imperium.searchinsight.service.SearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 搜索接口。
 * POST /api/v1/search、GET /api/v1/search 返回完整结果；GET /api/v1/search/answer 返回纯文本答案。
 */
@RestController
@RequestMapping("/api/v1/search")
@Tag(name = "search", description = "Cached web search insights")
public class SearchController {

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Enhanced search with explicit parameters")
    public Mono<EnhancedSearchResult> search(@Valid @RequestBody SearchRequest request) {
        return searchService.enhancedSearch(
                request.getQuery(),
                request.getRequesterId(),
                request.getSearchType(),
                request.getParams());
    }

    /**
     * 默认参数的 GET 版本，便于调试。
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Enhanced search with default parameters")
    public Mono<EnhancedSearchResult> search(
            @RequestParam String query,
            @RequestParam(defaultValue = "anonymous") String requesterId,
            @RequestParam(defaultValue = "general") String searchType) {
        return searchService.enhancedSearch(query, requesterId, searchType, null);
    }

    @GetMapping(value = "/answer", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Plain-text answer (legacy search_the_web)")
    public Mono<String> answer(
            @RequestParam String query,
            @RequestParam(defaultValue = "anonymous") String requesterId,
            @RequestParam(defaultValue = "general") String searchType) {
        return searchService.searchTheWeb(query, requesterId, searchType);
    }
}
