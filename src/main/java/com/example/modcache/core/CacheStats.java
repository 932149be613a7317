package com.example.modcache.core;

import java.time.Duration;

public record CacheStats(
    String name,
    int size,
    int capacity,
    Duration ttl,
    long hits,
    long misses,
    long evictions,
    long expirations
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
