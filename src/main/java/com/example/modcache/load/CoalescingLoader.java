package com.example.modcache.load;

import com.example.modcache.core.CacheLoader;
import com.example.modcache.core.TtlCache;
import com.example.modcache.error.CacheLoadException;
import com.example.modcache.error.LoadTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs at most one load per (domain, key) at a time. Concurrent callers for the same missing
 * key join the in-flight future; callers for other keys never wait on it.
 *
 * <p>Each load is bounded by {@code timeout}, measured from when it was started. On timeout the
 * slot is released and the worker is interrupted, so the next caller starts a fresh load on a
 * free thread.
 *
 * <p>A load only stores its result if no invalidation hit the cache while it ran. Invalidating
 * callers also {@link #forget} the slot, so readers arriving after a write start a new load
 * instead of joining one that read the old value.
 */
@Slf4j
public class CoalescingLoader implements AutoCloseable {

    private final ConcurrentHashMap<LoadKey, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    // Dedicated pool so slow loaders never run on the common ForkJoinPool
    private final ExecutorService loaderExecutor;
    private final Duration timeout;

    public CoalescingLoader(int loaderThreads, Duration timeout) {
        if (loaderThreads <= 0) {
            throw new IllegalArgumentException("loaderThreads must be positive: " + loaderThreads);
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.loaderExecutor = Executors.newFixedThreadPool(loaderThreads, new LoaderThreadFactory());
        this.timeout = timeout;
    }

    public <K, V> V getOrLoad(String domain, K key, TtlCache<K, V> cache, CacheLoader<? extends V> loader) {
        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        LoadKey slot = new LoadKey(domain, key);
        CompletableFuture<Object> future = inFlight.computeIfAbsent(slot, k -> startLoad(key, cache, loader));

        try {
            return (V) future.get();
        } catch (ExecutionException e) {
            throw translate(domain, key, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheLoadException(domain, key, e);
        } finally {
            inFlight.remove(slot, future);
        }
    }

    /**
     * Detaches the in-flight load for one key. Callers already waiting on it still get its
     * result; later callers start a new load.
     */
    public void forget(String domain, Object key) {
        inFlight.remove(new LoadKey(domain, key));
    }

    public int forgetMatching(String domain, Predicate<Object> keyFilter) {
        int removed = 0;
        for (LoadKey slot : inFlight.keySet()) {
            if (slot.domain().equals(domain) && keyFilter.test(slot.key()) && inFlight.remove(slot) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private <K, V> CompletableFuture<Object> startLoad(K key, TtlCache<K, V> cache, CacheLoader<? extends V> loader) {
        // taken before the loader reads anything, on the caller's thread
        long stamp = cache.invalidationStamp();
        CompletableFuture<Object> result = new CompletableFuture<>();
        Future<?> task = loaderExecutor.submit(() -> {
            try {
                result.complete(loadAndStore(key, cache, loader, stamp));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, failure) -> {
            if (failure instanceof TimeoutException) {
                // frees the worker; a loader that ignores interrupts still holds it
                task.cancel(true);
            }
        });
        return result;
    }

    private <K, V> Object loadAndStore(K key, TtlCache<K, V> cache, CacheLoader<? extends V> loader, long stamp)
        throws Exception {
        // a load that finished just before this one was queued already filled the cache
        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.load();
        if (value != null && !cache.setIfNotInvalidatedSince(key, value, stamp)) {
            log.debug("Dropped load result invalidated mid-flight: cache={}, key={}", cache.name(), key);
        }
        return value;
    }

    private RuntimeException translate(String domain, Object key, Throwable cause) {
        if (cause instanceof TimeoutException) {
            log.warn("Load timed out: domain={}, key={}, timeout={}ms", domain, key, timeout.toMillis());
            return new LoadTimeoutException(domain, key, timeout);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new CacheLoadException(domain, key, cause);
    }

    @Override
    public void close() {
        loaderExecutor.shutdownNow();
    }

    private record LoadKey(String domain, Object key) {
    }

    private static final class LoaderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "modcache-loader-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
