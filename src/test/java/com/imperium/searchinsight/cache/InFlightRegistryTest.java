package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.SearchInsight;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.policy.QueryNormalizer;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InFlightRegistryTest {

    private final InFlightRegistry registry = new InFlightRegistry();

    private static CacheKey key(String text) {
        return CacheKey.of(QueryNormalizer.normalize(SearchQuery.builder().text(text).build()));
    }

    private static SearchInsight insight(String title) {
        return SearchInsight.builder().title(title).summary(title).url("").source(InsightSource.PRIMARY).build();
    }

    @Test
    void concurrentCallersShareOneResolution() {
        AtomicInteger starts = new AtomicInteger();
        Sinks.One<SearchInsight> upstream = Sinks.one();
        CacheKey key = key("shared");

        Mono<SearchInsight> first = registry.joinOrStart(key, () -> {
            starts.incrementAndGet();
            return upstream.asMono();
        });
        Mono<SearchInsight> second = registry.joinOrStart(key, () -> {
            starts.incrementAndGet();
            return Mono.just(insight("other"));
        });

        // 订阅后才真正注册
        var r1 = first.toFuture();
        var r2 = second.toFuture();
        assertTrue(registry.isInFlight(key));

        SearchInsight value = insight("one");
        upstream.tryEmitValue(value);

        assertSame(value, r1.join());
        assertSame(value, r2.join());
        assertEquals(1, starts.get());
        assertFalse(registry.isInFlight(key));
    }

    @Test
    void failureIsSharedAndReleased() {
        CacheKey key = key("boom");
        Mono<SearchInsight> call = registry.joinOrStart(key, () -> Mono.error(new IllegalStateException("boom")));
        assertThrows(IllegalStateException.class, call::block);
        assertEquals(0, registry.size());

        // 下一次调用重新开始
        SearchInsight again = registry.joinOrStart(key, () -> Mono.just(insight("again"))).block();
        assertEquals("again", again.getTitle());
    }

    @Test
    void factoryThrowingSynchronouslyReleasesSlot() {
        CacheKey key = key("sync");
        Mono<SearchInsight> call = registry.joinOrStart(key, () -> {
            throw new IllegalArgumentException("bad factory");
        });
        assertThrows(IllegalArgumentException.class, call::block);
        assertFalse(registry.isInFlight(key));
    }

    @Test
    void callerTimeoutDoesNotCancelUpstream() {
        CacheKey key = key("slow");
        Sinks.One<SearchInsight> upstream = Sinks.one();
        AtomicInteger cancelled = new AtomicInteger();
        Mono<SearchInsight> slow = registry.joinOrStart(key,
                () -> upstream.asMono().doOnCancel(cancelled::incrementAndGet));

        assertThrows(RuntimeException.class, () -> slow.timeout(Duration.ofMillis(50)).block());
        assertTrue(registry.isInFlight(key));

        SearchInsight late = registry.joinOrStart(key, () -> Mono.just(insight("dup"))).toFuture().getNow(null);
        assertNull(late);

        upstream.tryEmitValue(insight("done"));
        assertEquals(0, cancelled.get());
        assertFalse(registry.isInFlight(key));
    }
}
