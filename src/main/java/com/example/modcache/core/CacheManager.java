package com.example.modcache.core;

import com.example.modcache.load.CoalescingLoader;
import com.example.modcache.ratelimit.SlidingWindowRateLimiter;
import com.example.modcache.storage.StorageAccessor;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * Facade over the per-domain caches and the admission limiter.
 *
 * <p>Owns its caches, its limiter and its loader pool. The {@link StorageAccessor} is shared and
 * is closed by whoever opened it.
 *
 * <p>Lifecycle: construct, {@link #start()} to schedule the periodic sweep, {@link #close()} on
 * shutdown.
 */
@Slf4j
public class CacheManager implements AutoCloseable {

    private final Map<String, TtlCache<Object, Object>> caches;
    private final SlidingWindowRateLimiter rateLimiter;
    private final StorageAccessor storage;
    private final CoalescingLoader loader;
    private final TaskScheduler scheduler;
    private final Duration sweepInterval;

    private volatile ScheduledFuture<?> sweepTask;

    public CacheManager(
        Collection<TtlCache<Object, Object>> caches,
        SlidingWindowRateLimiter rateLimiter,
        StorageAccessor storage,
        CoalescingLoader loader,
        TaskScheduler scheduler,
        Duration sweepInterval
    ) {
        Objects.requireNonNull(caches, "caches");
        Map<String, TtlCache<Object, Object>> byName = new LinkedHashMap<>();
        for (TtlCache<Object, Object> cache : caches) {
            if (byName.putIfAbsent(cache.name(), cache) != null) {
                throw new IllegalArgumentException("Duplicate cache domain: " + cache.name());
            }
        }
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.caches = Collections.unmodifiableMap(byName);
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.sweepInterval = sweepInterval;
    }

    /**
     * Returns the cached value for {@code (domain, key)}, loading and caching it on a miss.
     * Concurrent misses on the same pair share one load. A null result is returned but not cached.
     *
     * @throws com.example.modcache.error.LoadTimeoutException the load exceeded its time bound
     * @throws com.example.modcache.error.CacheLoadException the loader threw a checked exception
     */
    public <V> V getOrLoad(String domain, Object key, CacheLoader<? extends V> valueLoader) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueLoader, "valueLoader");
        return (V) loader.getOrLoad(domain, key, cache(domain), valueLoader);
    }

    public <V> Optional<V> get(String domain, Object key) {
        return (Optional<V>) cache(domain).get(key);
    }

    public void put(String domain, Object key, Object value) {
        cache(domain).set(key, value);
    }

    public void put(String domain, Object key, Object value, Duration ttl) {
        cache(domain).set(key, value, ttl);
    }

    /**
     * Drops one entry. A load for the key that is still running is detached and will not store
     * its result, so the next read goes back to the loader. Call after the backing write commits.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String domain, Object key) {
        Objects.requireNonNull(key, "key");
        TtlCache<Object, Object> cache = cache(domain);
        loader.forget(domain, key);
        return cache.invalidate(key);
    }

    public int invalidateMatching(String domain, Predicate<Object> keyFilter) {
        Objects.requireNonNull(keyFilter, "keyFilter");
        TtlCache<Object, Object> cache = cache(domain);
        loader.forgetMatching(domain, keyFilter);
        return cache.invalidateIf(keyFilter);
    }

    public int invalidateAll(String domain) {
        TtlCache<Object, Object> cache = cache(domain);
        loader.forgetMatching(domain, key -> true);
        return cache.clear();
    }

    /**
     * One sweep pass: drops expired entries from every cache and empty limiter windows.
     *
     * @return total cache entries removed
     */
    public int sweep() {
        int removed = 0;
        for (TtlCache<Object, Object> cache : caches.values()) {
            int expired = cache.sweep();
            if (expired > 0 && log.isDebugEnabled()) {
                log.debug("Sweep removed {} expired entries from {}", expired, cache.name());
            }
            removed += expired;
        }
        int prunedActors = rateLimiter.prune();
        if (prunedActors > 0 && log.isDebugEnabled()) {
            log.debug("Sweep dropped {} idle rate-limit windows", prunedActors);
        }
        return removed;
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepQuietly, sweepInterval);
        log.info("Cache sweep scheduled every {}s for domains {}", sweepInterval.toSeconds(), caches.keySet());
    }

    @Override
    public synchronized void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
            log.info("Cache sweep stopped");
        }
        loader.close();
    }

    public Map<String, CacheStats> stats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        caches.forEach((name, cache) -> stats.put(name, cache.stats()));
        return stats;
    }

    public Set<String> domains() {
        return caches.keySet();
    }

    public SlidingWindowRateLimiter rateLimiter() {
        return rateLimiter;
    }

    public StorageAccessor storage() {
        return storage;
    }

    private void sweepQuietly() {
        // an exception here would cancel the periodic task
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Cache sweep failed", e);
        }
    }

    private TtlCache<Object, Object> cache(String domain) {
        Objects.requireNonNull(domain, "domain");
        TtlCache<Object, Object> cache = caches.get(domain);
        if (cache == null) {
            throw new IllegalArgumentException("Unknown cache domain: " + domain + " (known: " + caches.keySet() + ")");
        }
        return cache;
    }
}
