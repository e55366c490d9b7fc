package com.imperium.searchinsight.telemetry;

import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.SearchType;

/**
 * 一条搜索生命周期事件。detail 为可选的补充说明（如失败原因）。
 */
public record SearchEvent(Kind kind,
                          String requesterId,
                          String query,
                          SearchType type,
                          String cacheKey,
                          InsightSource source,
                          long elapsedMs,
                          String detail) {

    public enum Kind {
        REJECTED,
        CACHE_HIT,
        JOINED,
        RESOLVED,
        PROVIDER_FAILED,
        STALE_SERVED,
        DEGRADED,
        CACHE_ERROR
    }

    public static SearchEvent of(Kind kind, String requesterId, String query, SearchType type, String cacheKey) {
        return new SearchEvent(kind, requesterId, query, type, cacheKey, null, 0L, null);
    }

    public SearchEvent withSource(InsightSource newSource, long newElapsedMs) {
        return new SearchEvent(kind, requesterId, query, type, cacheKey, newSource, newElapsedMs, detail);
    }

    public SearchEvent withDetail(String newDetail) {
        return new SearchEvent(kind, requesterId, query, type, cacheKey, source, elapsedMs, newDetail);
    }
}
