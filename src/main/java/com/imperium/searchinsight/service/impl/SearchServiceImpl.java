package com.imperium.searchinsight.service.impl;

import com.imperium.searchinsight.ai.orchestrator.SearchOrchestrator;
import com.imperium.searchinsight.cache.CacheKey;
import com.imperium.searchinsight.model.SearchInsight;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.model.SearchType;
import com.imperium.searchinsight.model.dto.response.EnhancedSearchResult;
import com.imperium.searchinsight.model.dto.response.SearchMetadata;
import com.imperium.searchinsight.policy.QueryNormalizer;
import com.imperium.searchinsight.service.SearchService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;

@Service
public class SearchServiceImpl implements SearchService {

    private final SearchOrchestrator orchestrator;

    public SearchServiceImpl(SearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Mono<String> searchTheWeb(String query, String requesterId, String searchType) {
        return Mono.defer(() -> orchestrator.search(toQuery(query, requesterId, searchType, null)))
                .map(insight -> insight.getSummary() != null ? insight.getSummary() : "");
    }

    @Override
    public Mono<EnhancedSearchResult> enhancedSearch(String query, String requesterId, String searchType,
                                                     SearchParams params) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            SearchQuery searchQuery = toQuery(query, requesterId, searchType, params);
            return orchestrator.search(searchQuery)
                    .map(insight -> toResult(insight, searchQuery, start));
        });
    }

    private static SearchQuery toQuery(String query, String requesterId, String searchType, SearchParams params) {
        return SearchQuery.builder()
                .text(query)
                .type(SearchType.fromValue(searchType))
                .params(params != null ? params : SearchParams.defaults())
                .requesterId(requesterId != null && !requesterId.isBlank() ? requesterId : QueryNormalizer.ANONYMOUS)
                .build();
    }

    private static EnhancedSearchResult toResult(SearchInsight insight, SearchQuery query, long start) {
        String digest = CacheKey.of(QueryNormalizer.normalize(query)).digest();
        SearchMetadata metadata = SearchMetadata.builder()
                .resultCount(insight.getResults() != null ? insight.getResults().size() : 0)
                .queryTimeMs(Duration.ofNanos(System.nanoTime() - start).toMillis())
                .searchType(query.getType().value())
                .cacheKey(digest)
                .build();
        return EnhancedSearchResult.builder()
                .insight(insight)
                .summary(insight.getSummary())
                .keywords(new ArrayList<>(insight.getKeywords()))
                .rawResults(new ArrayList<>(insight.getResults()))
                .metadata(metadata)
                .build();
    }
}
