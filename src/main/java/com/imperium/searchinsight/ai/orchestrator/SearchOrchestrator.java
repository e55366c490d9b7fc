package com.imperium.searchinsight.ai.orchestrator;

import com.imperium.searchinsight.assembler.ResultAssembler;
import com.imperium.searchinsight.cache.CacheEntry;
import com.imperium.searchinsight.cache.CacheKey;
import com.imperium.searchinsight.cache.CacheStore;
import com.imperium.searchinsight.cache.InFlightRegistry;
import com.imperium.searchinsight.content.ContentProcessor;
import com.imperium.searchinsight.exception.SearchValidationException;
import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.ProcessedContent;
import com.imperium.searchinsight.model.SearchInsight;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.policy.CacheTtlPolicy;
import com.imperium.searchinsight.policy.QueryNormalizer;
import com.imperium.searchinsight.provider.ProviderGateway;
import com.imperium.searchinsight.provider.ProviderResponse;
import com.imperium.searchinsight.telemetry.SearchEvent;
import com.imperium.searchinsight.telemetry.SearchEventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * 搜索编排器。
 * <p>
 * 流程：校验与归一化 → 计算缓存键 → 查缓存（命中直接返回，source=cache）→ 未命中则通过
 * {@link InFlightRegistry} 合并同键并发请求，由唯一的解析方执行 provider 调用 → 内容处理 → 组装 → 写缓存。
 * <p>
 * 只有校验失败会以错误结束；provider 全部失败、缓存异常、调用方超时都降级为陈旧缓存或最小结果。
 */
@Service
public class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final CacheStore cacheStore;
    private final InFlightRegistry inFlightRegistry;
    private final ProviderGateway providerGateway;
    private final ContentProcessor contentProcessor;
    private final ResultAssembler resultAssembler;
    private final CacheTtlPolicy ttlPolicy;
    private final SearchEventLogger events;
    private final Duration callerTimeout;

    @Autowired
    public SearchOrchestrator(CacheStore cacheStore,
                              InFlightRegistry inFlightRegistry,
                              ProviderGateway providerGateway,
                              ContentProcessor contentProcessor,
                              ResultAssembler resultAssembler,
                              CacheTtlPolicy ttlPolicy,
                              SearchEventLogger events,
                              @Value("${app.search.caller-timeout-ms:15000}") long callerTimeoutMs) {
        this.cacheStore = cacheStore;
        this.inFlightRegistry = inFlightRegistry;
        this.providerGateway = providerGateway;
        this.contentProcessor = contentProcessor;
        this.resultAssembler = resultAssembler;
        this.ttlPolicy = ttlPolicy;
        this.events = events;
        this.callerTimeout = Duration.ofMillis(Math.max(1, callerTimeoutMs));
    }

    public Duration getCallerTimeout() {
        return callerTimeout;
    }

    public Mono<SearchInsight> search(SearchQuery query) {
        return search(query, callerTimeout);
    }

    /**
     * @param timeout 仅限制本调用方的等待时间，不会取消进行中的上游解析
     * @return 校验失败时以 {@link SearchValidationException} 结束，其余情况总是给出结果
     */
    public Mono<SearchInsight> search(SearchQuery query, Duration timeout) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            SearchQuery normalized;
            try {
                normalized = QueryNormalizer.normalize(query);
            } catch (SearchValidationException e) {
                events.record(SearchEvent.of(SearchEvent.Kind.REJECTED,
                                query != null ? query.getRequesterId() : null,
                                query != null ? query.getText() : null,
                                query != null ? query.getType() : null,
                                null)
                        .withDetail(e.getMessage()));
                return Mono.error(e);
            }

            CacheKey key = CacheKey.of(normalized);
            String digest = key.digest();

            Optional<CacheEntry> hit = readFresh(normalized, key, digest);
            if (hit.isPresent()) {
                events.record(event(SearchEvent.Kind.CACHE_HIT, normalized, digest)
                        .withSource(InsightSource.CACHE, elapsedMs(start)));
                return Mono.just(hit.get().insight().withSource(InsightSource.CACHE));
            }

            if (inFlightRegistry.isInFlight(key)) {
                events.record(event(SearchEvent.Kind.JOINED, normalized, digest));
            }
            Mono<SearchInsight> shared = inFlightRegistry.joinOrStart(key, () -> resolve(normalized, key, digest, start));
            Duration wait = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : callerTimeout;
            // 同一次解析的结果分发给多个等待方，每人拿一份副本
            return shared
                    .map(SearchInsight::copy)
                    .timeout(wait)
                    .onErrorResume(e -> !(e instanceof SearchValidationException),
                            e -> Mono.fromSupplier(() -> degrade(normalized, key, digest, e, start)));
        });
    }

    /**
     * 由唯一的解析方执行；写缓存发生在结果交给所有等待方之前。
     */
    private Mono<SearchInsight> resolve(SearchQuery query, CacheKey key, String digest, long start) {
        // 双重检查：刚结束的解析可能已经写入缓存
        Optional<CacheEntry> recheck = readFresh(query, key, digest);
        if (recheck.isPresent()) {
            return Mono.just(recheck.get().insight().withSource(InsightSource.CACHE));
        }
        return providerGateway.fetch(query)
                .map(response -> {
                    SearchInsight insight = build(response);
                    write(query, key, digest, insight, response.source());
                    events.record(event(SearchEvent.Kind.RESOLVED, query, digest)
                            .withSource(response.source(), elapsedMs(start)));
                    return insight;
                });
    }

    private SearchInsight build(ProviderResponse response) {
        ProcessedContent processed = contentProcessor.process(response.result());
        return resultAssembler.assemble(response.result(), processed, response.source());
    }

    private SearchInsight degrade(SearchQuery query, CacheKey key, String digest, Throwable error, long start) {
        String reason = error instanceof TimeoutException ? "caller wait timed out" : error.getMessage();
        events.record(event(SearchEvent.Kind.PROVIDER_FAILED, query, digest).withDetail(reason));

        Optional<CacheEntry> stale = readStale(query, key, digest);
        if (stale.isPresent()) {
            CacheEntry entry = stale.get();
            events.record(event(SearchEvent.Kind.STALE_SERVED, query, digest)
                    .withSource(InsightSource.CACHE, elapsedMs(start)));
            return entry.insight().toBuilder()
                    .source(InsightSource.CACHE)
                    .stale(cacheStore.isExpired(entry))
                    .build();
        }

        events.record(event(SearchEvent.Kind.DEGRADED, query, digest)
                .withSource(InsightSource.DEGRADED, elapsedMs(start)));
        return resultAssembler.degraded();
    }

    private Optional<CacheEntry> readFresh(SearchQuery query, CacheKey key, String digest) {
        try {
            return cacheStore.get(key);
        } catch (RuntimeException e) {
            cacheError(query, digest, "read", e);
            return Optional.empty();
        }
    }

    private Optional<CacheEntry> readStale(SearchQuery query, CacheKey key, String digest) {
        try {
            return cacheStore.getStale(key);
        } catch (RuntimeException e) {
            cacheError(query, digest, "stale read", e);
            return Optional.empty();
        }
    }

    private void write(SearchQuery query, CacheKey key, String digest, SearchInsight insight, InsightSource source) {
        try {
            cacheStore.put(key, insight, ttlPolicy.ttlFor(query.getType()), source);
        } catch (RuntimeException e) {
            cacheError(query, digest, "write", e);
        }
    }

    private void cacheError(SearchQuery query, String digest, String op, RuntimeException e) {
        log.warn("Cache {} failed, bypassing cache: {}", op, e.getMessage());
        events.record(event(SearchEvent.Kind.CACHE_ERROR, query, digest).withDetail(op + ": " + e.getMessage()));
    }

    private static SearchEvent event(SearchEvent.Kind kind, SearchQuery query, String digest) {
        return SearchEvent.of(kind, query.getRequesterId(), query.getText(), query.getType(), digest);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
