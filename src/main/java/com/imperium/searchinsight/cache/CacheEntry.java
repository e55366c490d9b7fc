package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.SearchInsight;

import java.time.Duration;
import java.time.Instant;

/**
 * 缓存条目，生命周期归 {@link CacheStore} 所有。source 记录写入时的 provider 来源。
 */
public record CacheEntry(CacheKey key,
                         SearchInsight insight,
                         Instant createdAt,
                         Duration ttl,
                         InsightSource source) {

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    /** 已过期但仍在宽限期内，可作为陈旧兜底 */
    public boolean isWithinGrace(Instant now, Duration grace) {
        return now.isBefore(expiresAt().plus(grace));
    }

    /** 结果替换为副本的同一条目，交给缓存外部使用 */
    CacheEntry detached() {
        return new CacheEntry(key, insight.copy(), createdAt, ttl, source);
    }
}
