package com.example.modcache.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window log limiter: an actor may make {@code maxRequests} requests in any
 * {@code window}-long interval ending now. Exact timestamps are kept, so each check costs
 * O(requests in window).
 *
 * <p>Each actor's window is mutated only through {@link ConcurrentHashMap#compute}, so callers
 * for different actors do not contend on a shared lock. Windows that prune down to empty are
 * removed from the map.
 *
 * <p>Instances are independent; create one per rate-limited feature.
 */
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean allow(String actorId) {
        return tryAcquire(actorId).allowed();
    }

    public RateDecision tryAcquire(String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        RateDecision[] decision = new RateDecision[1];

        windows.compute(actorId, (id, existing) -> {
            // read under the actor's bin lock so timestamps are appended in order
            Instant now = clock.instant();
            RateWindow actorWindow = existing != null ? existing : new RateWindow();
            actorWindow.prune(now.minus(window));
            if (actorWindow.size() < maxRequests) {
                actorWindow.record(now);
                decision[0] = RateDecision.allowed(maxRequests - actorWindow.size());
            } else {
                decision[0] = RateDecision.denied(retryAfter(actorWindow.oldest(), now));
            }
            return actorWindow.isEmpty() ? null : actorWindow;
        });
        return decision[0];
    }

    /**
     * Requests still available to {@code actorId} in the current window. Does not consume one.
     */
    public int remaining(String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        int[] used = new int[1];

        windows.computeIfPresent(actorId, (id, actorWindow) -> {
            actorWindow.prune(clock.instant().minus(window));
            used[0] = actorWindow.size();
            return actorWindow.isEmpty() ? null : actorWindow;
        });
        return maxRequests - used[0];
    }

    public void reset(String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        windows.remove(actorId);
    }

    /**
     * Prunes every window and drops the ones left empty.
     *
     * @return number of actors removed
     */
    public int prune() {
        int removed = 0;
        for (String actorId : windows.keySet()) {
            boolean[] emptied = new boolean[1];
            windows.computeIfPresent(actorId, (id, actorWindow) -> {
                actorWindow.prune(clock.instant().minus(window));
                emptied[0] = actorWindow.isEmpty();
                return emptied[0] ? null : actorWindow;
            });
            if (emptied[0]) {
                removed++;
            }
        }
        return removed;
    }

    public int trackedActors() {
        return windows.size();
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return window;
    }

    private Duration retryAfter(Instant oldest, Instant now) {
        Duration wait = Duration.between(now, oldest.plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
