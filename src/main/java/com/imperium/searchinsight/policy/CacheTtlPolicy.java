package com.imperium.searchinsight.policy;

import com.imperium.searchinsight.model.SearchType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 缓存 TTL 策略：新闻时效性强，TTL 较短。
 */
@Component
public class CacheTtlPolicy {

    private final Duration generalTtl;
    private final Duration newsTtl;
    private final Duration imageTtl;

    public CacheTtlPolicy(
            @Value("${app.search.cache.ttl-general-seconds:600}") long generalSeconds,
            @Value("${app.search.cache.ttl-news-seconds:300}") long newsSeconds,
            @Value("${app.search.cache.ttl-image-seconds:600}") long imageSeconds) {
        this.generalTtl = Duration.ofSeconds(Math.max(1, generalSeconds));
        this.newsTtl = Duration.ofSeconds(Math.max(1, newsSeconds));
        this.imageTtl = Duration.ofSeconds(Math.max(1, imageSeconds));
    }

    public Duration ttlFor(SearchType type) {
        if (type == null) {
            return generalTtl;
        }
        return switch (type) {
            case NEWS -> newsTtl;
            case IMAGE -> imageTtl;
            default -> generalTtl;
        };
    }
}
