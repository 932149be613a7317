package com.example.modcache.core;

import java.time.Instant;

public class CacheEntry<K, V> {
    public final K key;
    public final V value;
    public final Instant createdAt;
    public final Instant expiresAt;   // absolute instant after which the entry is stale
    public volatile Instant lastAccessed;

    public CacheEntry(K key, V value, Instant createdAt, Instant expiresAt) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastAccessed = createdAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
