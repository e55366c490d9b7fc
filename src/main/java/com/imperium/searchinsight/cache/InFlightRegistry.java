package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.model.SearchInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 同一缓存键的并发请求合并为一次上游解析（single-flight）。
 * <p>
 * 第一个调用方注册共享的 pending 结果并启动 factory，其余调用方等待同一结果。
 * 解析结束（成功或失败）后立即移除条目，之后的调用重新开始。
 * 上游解析独立订阅，调用方取消或超时只结束自己的等待，不会取消上游。
 */
@Component
public class InFlightRegistry {

    private static final Logger log = LoggerFactory.getLogger(InFlightRegistry.class);

    private final ConcurrentHashMap<CacheKey, CompletableFuture<SearchInsight>> inFlight = new ConcurrentHashMap<>();

    public Mono<SearchInsight> joinOrStart(CacheKey key, Supplier<Mono<SearchInsight>> factory) {
        return Mono.defer(() -> {
            CompletableFuture<SearchInsight> created = new CompletableFuture<>();
            CompletableFuture<SearchInsight> existing = inFlight.putIfAbsent(key, created);
            if (existing != null) {
                log.debug("Joined in-flight resolution: {}", key.digest());
                return Mono.fromFuture(existing, true);
            }
            start(key, created, factory);
            return Mono.fromFuture(created, true);
        });
    }

    public boolean isInFlight(CacheKey key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }

    private void start(CacheKey key, CompletableFuture<SearchInsight> slot, Supplier<Mono<SearchInsight>> factory) {
        Mono<SearchInsight> upstream;
        try {
            upstream = factory.get();
        } catch (RuntimeException e) {
            release(key, slot);
            slot.completeExceptionally(e);
            return;
        }
        upstream.subscribe(
                value -> {
                    release(key, slot);
                    slot.complete(value);
                },
                error -> {
                    release(key, slot);
                    slot.completeExceptionally(error);
                },
                () -> {
                    if (!slot.isDone()) {
                        release(key, slot);
                        slot.completeExceptionally(new IllegalStateException("resolution completed without a result"));
                    }
                });
    }

    private void release(CacheKey key, CompletableFuture<SearchInsight> slot) {
        inFlight.remove(key, slot);
    }
}
