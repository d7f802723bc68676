package com.tailorai.infrastructure.ai.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caffeine-backed content cache with one bounded cache per artifact type, so hit
 * rates can be read per artifact. Evicted entries are simply regenerated.
 */
@Slf4j
@Component
public class CaffeineContentCache implements ContentCache {

    private final Map<String, Cache<String, Object>> caches = new ConcurrentHashMap<>();
    private final long maximumSize;

    public CaffeineContentCache(@Value("${tailor.cache.maximum-size:10000}") long maximumSize) {
        this.maximumSize = maximumSize;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = cacheFor(type.getSimpleName()).getIfPresent(key);
        if (!type.isInstance(value)) {
            return Optional.empty();
        }
        log.info("[Cache] hit {} - cumulative hitRate={}%",
                type.getSimpleName(), String.format("%.1f", stats(type).hitRate() * 100));
        return Optional.of(type.cast(value));
    }

    @Override
    public void putIfAbsent(String key, Object value) {
        if (cacheFor(value.getClass().getSimpleName()).asMap().putIfAbsent(key, value) == null) {
            log.debug("[Cache] Stored {} under {}", value.getClass().getSimpleName(), key);
        }
    }

    /**
     * Hit/miss statistics of one artifact type.
     */
    public CacheStats stats(Class<?> type) {
        Cache<String, Object> cache = caches.get(type.getSimpleName());
        return cache == null ? CacheStats.empty() : cache.stats();
    }

    /**
     * Entries currently held for one artifact type, after pending evictions.
     */
    public long size(Class<?> type) {
        Cache<String, Object> cache = caches.get(type.getSimpleName());
        if (cache == null) {
            return 0;
        }
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private Cache<String, Object> cacheFor(String artifact) {
        return caches.computeIfAbsent(artifact, k -> Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build());
    }
}
