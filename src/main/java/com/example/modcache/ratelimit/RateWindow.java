package com.example.modcache.ratelimit;

import java.time.Instant;
import java.util.ArrayDeque;

/**
 * Timestamp log for one actor, oldest first. Only touched from inside
 * {@code ConcurrentHashMap.compute} on the actor's key, which serializes access per actor.
 */
final class RateWindow {

    private final ArrayDeque<Instant> timestamps = new ArrayDeque<>();

    /**
     * Drops every timestamp at or before {@code cutoff}.
     */
    void prune(Instant cutoff) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }

    void record(Instant now) {
        timestamps.addLast(now);
    }

    Instant oldest() {
        return timestamps.peekFirst();
    }

    int size() {
        return timestamps.size();
    }

    boolean isEmpty() {
        return timestamps.isEmpty();
    }
}
