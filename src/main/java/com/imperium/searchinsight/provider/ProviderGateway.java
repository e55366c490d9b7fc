package com.imperium.searchinsight.provider;

import com.imperium.searchinsight.exception.ProviderException;
import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.RawSearchResult;
import com.imperium.searchinsight.model.SearchQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Provider 网关：先调 primary，失败则切到 fallback，两者都失败则整体失败。
 * <p>
 * 状态流转：Idle → PrimaryCall → Success | PrimaryFailed → FallbackCall → Success | Failed。
 * 超时、传输错误、空响应、鉴权/配额错误、解析错误都视为失败；同一 provider 不重试。
 * 阻塞的 provider 调用通过 subscribeOn 放到有界的 providerScheduler 上，不占用调用方线程。
 */
@Service
public class ProviderGateway {

    private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

    private final PrimarySearchProvider primary;
    private final FallbackSearchProvider fallback;
    private final PageContentFetcher pageContentFetcher;
    private final Scheduler providerScheduler;
    private final Duration primaryTimeout;
    private final Duration fallbackTimeout;

    @Autowired
    public ProviderGateway(PrimarySearchProvider primary,
                           FallbackSearchProvider fallback,
                           PageContentFetcher pageContentFetcher,
                           @Qualifier("providerScheduler") Scheduler providerScheduler,
                           @Value("${app.search.primary.timeout-ms:8000}") long primaryTimeoutMs,
                           @Value("${app.search.fallback.timeout-ms:5000}") long fallbackTimeoutMs) {
        this(primary, fallback, pageContentFetcher, providerScheduler,
                Duration.ofMillis(primaryTimeoutMs), Duration.ofMillis(fallbackTimeoutMs));
    }

    public ProviderGateway(PrimarySearchProvider primary,
                           FallbackSearchProvider fallback,
                           PageContentFetcher pageContentFetcher,
                           Scheduler providerScheduler,
                           Duration primaryTimeout,
                           Duration fallbackTimeout) {
        this.primary = primary;
        this.fallback = fallback;
        this.pageContentFetcher = pageContentFetcher;
        this.providerScheduler = providerScheduler;
        this.primaryTimeout = primaryTimeout;
        this.fallbackTimeout = fallbackTimeout;
    }

    /**
     * @param query 已归一化的查询
     * @return 成功时为应答结果与来源；两个 provider 都失败时以 {@link ProviderException} 结束
     */
    public Mono<ProviderResponse> fetch(SearchQuery query) {
        Mono<ProviderResponse> primaryCall = invoke(primary.id(),
                () -> primary.query(query.getText(), query.getType(), query.getParams()), primaryTimeout)
                .map(result -> new ProviderResponse(result, InsightSource.PRIMARY));

        return primaryCall
                .onErrorResume(primaryError -> {
                    log.warn("Primary provider {} failed, switching to {}: {}",
                            primary.id(), fallback.id(), primaryError.getMessage());
                    return invoke(fallback.id(), () -> fallback.query(query.getText()), fallbackTimeout)
                            .map(result -> new ProviderResponse(result, InsightSource.FALLBACK))
                            .onErrorMap(fallbackError -> {
                                log.warn("Fallback provider {} failed: {}", fallback.id(), fallbackError.getMessage());
                                ProviderException failed = new ProviderException("gateway",
                                        "all providers failed", fallbackError);
                                failed.addSuppressed(primaryError);
                                return failed;
                            });
                })
                .publishOn(providerScheduler)
                .map(this::enrichPages);
    }

    private Mono<RawSearchResult> invoke(String providerId, Callable<RawSearchResult> call, Duration timeout) {
        return Mono.fromCallable(call)
                .subscribeOn(providerScheduler)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new ProviderException(providerId, "timed out after " + timeout.toMillis() + "ms", e))
                .onErrorMap(e -> !(e instanceof ProviderException),
                        e -> new ProviderException(providerId, "call failed: " + e, e))
                .filter(result -> !result.isEmpty())
                .switchIfEmpty(Mono.error(() -> new ProviderException(providerId, "empty response")));
    }

    private ProviderResponse enrichPages(ProviderResponse response) {
        if (!pageContentFetcher.isEnabled()) {
            return response;
        }
        RawSearchResult raw = response.result();
        return new ProviderResponse(
                new RawSearchResult(pageContentFetcher.enrich(raw.items()), raw.directAnswer()),
                response.source());
    }
}
