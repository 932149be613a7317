package com.example.modcache.ratelimit;

import java.time.Duration;

/**
 * Outcome of one admission check. A denial is a normal result, not an error.
 *
 * @param allowed whether the request was admitted (and recorded)
 * @param remaining requests still available in the current window after this decision
 * @param retryAfter time until the oldest request leaves the window; zero when allowed
 */
public record RateDecision(boolean allowed, int remaining, Duration retryAfter) {

    public static RateDecision allowed(int remaining) {
        return new RateDecision(true, remaining, Duration.ZERO);
    }

    public static RateDecision denied(Duration retryAfter) {
        return new RateDecision(false, 0, retryAfter);
    }
}
