package com.example.modcache.eviction;

/**
 * Eviction order a cache domain is configured with.
 */
public enum EvictionPolicy {
    LRU,
    FIFO;

    public <K> EvictionStrategy<K> newStrategy() {
        return this == FIFO ? new FifoEvictionStrategy<>() : new LruEvictionStrategy<>();
    }
}
