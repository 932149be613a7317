package com.example.modcache.eviction;

import java.util.Map;
import java.util.Optional;

/**
 * Recency bookkeeping for a bounded cache. Implementations are not thread-safe on their own;
 * the owning cache calls them while holding its lock.
 */
public interface EvictionStrategy<K> {
    void onHit(K key);
    void onInsert(K key);
    void onRemove(K key);
    Optional<K> selectVictim(Map<K, ?> store);
    void clear();
}
