package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.exception.CacheException;
import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.SearchInsight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 有界、带 TTL 的内存缓存，超出容量时淘汰最久未使用的条目（LRU）。
 * <p>
 * 过期条目对 {@link #get} 不可见，但在宽限期内保留，供两个 provider 都失败时通过
 * {@link #getStale} 返回陈旧结果。所有操作由一把全局锁串行化，读方不会看到写了一半的条目。
 * 写入时保存结果的副本，读取时也返回副本，调用方修改拿到的结果不会影响缓存。
 * 进程重启即清空，不做持久化。
 */
@Component
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final int maxEntries;
    private final Duration staleGrace;
    private final Clock clock;

    /** 插入顺序即使用顺序：命中时移到队尾，队首为最久未使用 */
    private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public CacheStore(@Value("${app.search.cache.max-entries:500}") int maxEntries,
                      @Value("${app.search.cache.stale-grace-seconds:900}") long staleGraceSeconds) {
        this(maxEntries, Duration.ofSeconds(Math.max(0, staleGraceSeconds)), Clock.systemUTC());
    }

    public CacheStore(int maxEntries, Duration staleGrace, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        this.maxEntries = maxEntries;
        this.staleGrace = staleGrace != null ? staleGrace : Duration.ZERO;
        this.clock = clock;
    }

    /**
     * 正常查询：只返回未过期条目，并刷新其使用顺序。
     */
    public Optional<CacheEntry> get(CacheKey key) {
        if (key == null) {
            throw new CacheException("cache key must not be null");
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            entries.remove(key);
            entries.put(key, entry);
            return Optional.of(entry.detached());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 陈旧兜底查询：条目已过期但仍在宽限期内时返回。未过期的条目也会返回。
     */
    public Optional<CacheEntry> getStale(CacheKey key) {
        if (key == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || !entry.isWithinGrace(now, staleGrace)) {
                return Optional.empty();
            }
            return Optional.of(entry.detached());
        } finally {
            lock.unlock();
        }
    }

    public void put(CacheKey key, SearchInsight insight, Duration ttl, InsightSource source) {
        if (key == null || insight == null) {
            throw new CacheException("cache key and insight must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new CacheException("ttl must be positive");
        }
        CacheEntry entry = new CacheEntry(key, insight.copy(), clock.instant(), ttl, source);
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, entry);
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 先清理超过宽限期的条目，再按 LRU 淘汰超出容量的部分。
     *
     * @return 本次移除的条目数
     */
    public int evictIfNeeded() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry e = it.next().getValue();
                if (!e.isWithinGrace(now, staleGrace)) {
                    it.remove();
                    removed++;
                }
            }
            it = entries.entrySet().iterator();
            while (entries.size() > maxEntries && it.hasNext()) {
                CacheKey eldest = it.next().getKey();
                it.remove();
                removed++;
                log.debug("Cache evicted LRU entry: {}", eldest.digest());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** 按本缓存的时钟判断条目是否已过期 */
    public boolean isExpired(CacheEntry entry) {
        return entry.isExpired(clock.instant());
    }

    /** 是否持有该键（含宽限期内的过期条目） */
    public boolean contains(CacheKey key) {
        return getStale(key).isPresent();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
