package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.exception.CacheException;
import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.SearchInsight;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.policy.QueryNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheStoreTest {

    private static final Duration TTL = Duration.ofSeconds(60);
    private static final Duration GRACE = Duration.ofSeconds(30);

    private MutableClock clock;
    private CacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new CacheStore(3, GRACE, clock);
    }

    private static CacheKey key(String text) {
        return CacheKey.of(QueryNormalizer.normalize(SearchQuery.builder().text(text).build()));
    }

    private static SearchInsight insight(String title) {
        return SearchInsight.builder().title(title).summary(title).url("").source(InsightSource.PRIMARY).build();
    }

    @Test
    void putThenGetReturnsEntry() {
        store.put(key("a"), insight("A"), TTL, InsightSource.PRIMARY);
        CacheEntry entry = store.get(key("a")).orElseThrow();
        assertEquals("A", entry.insight().getTitle());
        assertEquals(InsightSource.PRIMARY, entry.source());
    }

    @Test
    void expiredEntryIsInvisibleToGetButServedStaleWithinGrace() {
        store.put(key("a"), insight("A"), TTL, InsightSource.PRIMARY);
        clock.advance(TTL.plusSeconds(1));

        assertTrue(store.get(key("a")).isEmpty());
        CacheEntry stale = store.getStale(key("a")).orElseThrow();
        assertTrue(store.isExpired(stale));

        clock.advance(GRACE);
        assertTrue(store.getStale(key("a")).isEmpty());
        assertFalse(store.contains(key("a")));
    }

    @Test
    void insertAtCapacityEvictsLeastRecentlyUsed() {
        store.put(key("a"), insight("A"), TTL, InsightSource.PRIMARY);
        store.put(key("b"), insight("B"), TTL, InsightSource.PRIMARY);
        store.put(key("c"), insight("C"), TTL, InsightSource.PRIMARY);

        // a 被访问后，b 成为最久未使用
        assertTrue(store.get(key("a")).isPresent());
        store.put(key("d"), insight("D"), TTL, InsightSource.PRIMARY);

        assertEquals(3, store.size());
        assertTrue(store.get(key("b")).isEmpty());
        assertTrue(store.get(key("a")).isPresent());
        assertTrue(store.get(key("d")).isPresent());
    }

    @Test
    void evictIfNeededPurgesEntriesPastGrace() {
        store.put(key("a"), insight("A"), TTL, InsightSource.PRIMARY);
        store.put(key("b"), insight("B"), Duration.ofHours(1), InsightSource.FALLBACK);
        clock.advance(TTL.plus(GRACE).plusSeconds(1));

        assertEquals(1, store.evictIfNeeded());
        assertEquals(1, store.size());
        assertTrue(store.contains(key("b")));
    }

    @Test
    void overwriteReplacesEntry() {
        store.put(key("a"), insight("A1"), TTL, InsightSource.PRIMARY);
        store.put(key("a"), insight("A2"), TTL, InsightSource.FALLBACK);
        assertEquals(1, store.size());
        assertEquals("A2", store.get(key("a")).orElseThrow().insight().getTitle());
    }

    @Test
    void storedInsightIsIsolatedFromCallers() {
        SearchInsight original = insight("A");
        original.getKeywords().add("alpha");
        store.put(key("a"), original, TTL, InsightSource.PRIMARY);

        original.setSummary("changed");
        original.getKeywords().clear();

        SearchInsight read = store.get(key("a")).orElseThrow().insight();
        assertEquals("A", read.getSummary());
        assertEquals(List.of("alpha"), read.getKeywords());

        read.setSummary("changed again");
        read.getKeywords().add("beta");

        SearchInsight stale = store.getStale(key("a")).orElseThrow().insight();
        assertEquals("A", stale.getSummary());
        assertEquals(List.of("alpha"), stale.getKeywords());
    }

    @Test
    void invalidPutIsRejected() {
        assertThrows(CacheException.class, () -> store.put(null, insight("A"), TTL, InsightSource.PRIMARY));
        assertThrows(CacheException.class, () -> store.put(key("a"), insight("A"), Duration.ZERO, InsightSource.PRIMARY));
        assertThrows(CacheException.class, () -> store.get(null));
    }

    @Test
    void clearEmptiesStore() {
        store.put(key("a"), insight("A"), TTL, InsightSource.PRIMARY);
        store.clear();
        assertEquals(0, store.size());
    }

    @Test
    void concurrentWritersNeverExceedCapacity() throws Exception {
        CacheStore bounded = new CacheStore(50, GRACE, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.submit(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        CacheKey k = key("t" + thread + "-" + i);
                        bounded.put(k, insight("x"), TTL, InsightSource.PRIMARY);
                        bounded.get(k);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertEquals(50, bounded.size());
    }
}
