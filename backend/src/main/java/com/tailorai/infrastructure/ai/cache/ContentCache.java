package com.tailorai.infrastructure.ai.cache;

import java.util.Optional;

/**
 * Process-wide store of validated generation results, keyed by content hash.
 * Entries are written once and never invalidated. A bounded store may evict them,
 * in which case the artifact is generated again.
 */
public interface ContentCache {

    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store {@code value} unless the key is already present. Concurrent writers for
     * the same key store equivalent values, so the first one wins.
     */
    void putIfAbsent(String key, Object value);
}
