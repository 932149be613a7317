package com.example.modcache.core;

import com.example.modcache.eviction.EvictionStrategy;
import com.example.modcache.eviction.LruEvictionStrategy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-capacity cache with per-entry expiry and pluggable eviction, least recently used
 * unless another {@link EvictionStrategy} is given.
 *
 * <p>Expiry bounds staleness and capacity bounds memory independently: an entry may be
 * evicted under capacity pressure before its TTL runs out. Expired entries are dropped lazily
 * on read and eagerly by {@link #sweep()}.
 *
 * <p>All state sits behind one lock per instance. Reads take it too, since a hit reorders
 * the recency list.
 */
@Slf4j
public class TtlCache<K, V> {

    private final String name;
    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final EvictionStrategy<K> evictionStrategy;
    private final ReentrantLock lock = new ReentrantLock();
    private final HashMap<K, CacheEntry<K, V>> store = new HashMap<>();

    // guarded by lock
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    // bumped by every invalidation; never reset
    private long invalidations;

    public TtlCache(String name, int capacity, Duration ttl, Clock clock) {
        this(name, capacity, ttl, clock, new LruEvictionStrategy<>());
    }

    public TtlCache(String name, int capacity, Duration ttl, Clock clock, EvictionStrategy<K> evictionStrategy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.ttl = requirePositive(ttl, "ttl");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy, "evictionStrategy");
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry<K, V> entry = store.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                removeUnsafe(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            entry.lastAccessed = now;
            evictionStrategy.onHit(key);
            hits++;
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    public void set(K key, V value) {
        set(key, value, null);
    }

    /**
     * Inserts or replaces {@code key}. If the insert pushes the cache over capacity the
     * strategy's victim (least recently used by default) is evicted before this returns.
     *
     * @param ttlOverride lifetime for this entry only, or null for the cache default
     */
    public void set(K key, V value, Duration ttlOverride) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration entryTtl = ttlOverride == null ? ttl : requirePositive(ttlOverride, "ttlOverride");

        lock.lock();
        try {
            setUnsafe(key, value, entryTtl);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current invalidation stamp. A loader takes it before reading the backing store and hands
     * it to {@link #setIfNotInvalidatedSince} when it is done.
     */
    public long invalidationStamp() {
        lock.lock();
        try {
            return invalidations;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a loaded value unless any invalidation ran after {@code stamp} was taken. A value
     * read before a write must not outlive the invalidation that followed the write.
     *
     * @return true if the value was stored
     */
    public boolean setIfNotInvalidatedSince(K key, V value, long stamp) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (invalidations != stamp) {
                return false;
            }
            setUnsafe(key, value, ttl);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if an entry was removed
     */
    public boolean invalidate(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            invalidations++;
            return removeUnsafe(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public int invalidateIf(Predicate<? super K> keyFilter) {
        Objects.requireNonNull(keyFilter, "keyFilter");
        lock.lock();
        try {
            invalidations++;
            int removed = 0;
            Iterator<K> it = store.keySet().iterator();
            while (it.hasNext()) {
                K key = it.next();
                if (keyFilter.test(key)) {
                    it.remove();
                    evictionStrategy.onRemove(key);
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<Map.Entry<K, CacheEntry<K, V>>> it = store.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<K, V>> e = it.next();
                if (e.getValue().isExpired(now)) {
                    it.remove();
                    evictionStrategy.onRemove(e.getKey());
                    removed++;
                }
            }
            expirations += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Presence check that skips expired entries and leaves recency untouched.
     */
    public boolean containsKey(K key) {
        lock.lock();
        try {
            CacheEntry<K, V> entry = store.get(key);
            return entry != null && !entry.isExpired(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all entries and resets the hit, miss, eviction and expiry counters.
     *
     * @return number of entries dropped
     */
    public int clear() {
        lock.lock();
        try {
            int dropped = store.size();
            invalidations++;
            store.clear();
            evictionStrategy.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            expirations = 0;
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    public String name() {
        return name;
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(name, store.size(), capacity, ttl, hits, misses, evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    private void setUnsafe(K key, V value, Duration entryTtl) {
        Instant now = clock.instant();
        store.put(key, new CacheEntry<>(key, value, now, now.plus(entryTtl)));
        evictionStrategy.onInsert(key);

        while (store.size() > capacity) {
            Optional<K> victim = evictionStrategy.selectVictim(store);
            if (victim.isEmpty()) {
                break;
            }
            store.remove(victim.get());
            evictions++;
            if (log.isDebugEnabled()) {
                log.debug("Evicted entry: cache={}, key={}", name, victim.get());
            }
        }
    }

    private CacheEntry<K, V> removeUnsafe(K key) {
        CacheEntry<K, V> removed = store.remove(key);
        if (removed != null) {
            evictionStrategy.onRemove(key);
        }
        return removed;
    }

    private static Duration requirePositive(Duration duration, String label) {
        Objects.requireNonNull(duration, label);
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(label + " must be positive: " + duration);
        }
        return duration;
    }
}
