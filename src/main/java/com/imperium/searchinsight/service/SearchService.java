package com.imperium.searchinsight.service;

import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.dto.response.EnhancedSearchResult;
import reactor.core.publisher.Mono;

/**
 * 对外的两个搜索入口，都是 {@link com.imperium.searchinsight.ai.orchestrator.SearchOrchestrator} 结果的投影。
 */
public interface SearchService {

    /**
     * 旧接口：只返回摘要（有直接答案时即为直接答案）的纯文本。
     */
    Mono<String> searchTheWeb(String query, String requesterId, String searchType);

    Mono<EnhancedSearchResult> enhancedSearch(String query, String requesterId, String searchType, SearchParams params);
}
