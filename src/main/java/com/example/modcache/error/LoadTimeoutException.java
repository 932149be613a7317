package com.example.modcache.error;

import java.time.Duration;
import lombok.Getter;

/**
 * The loader behind {@code getOrLoad} did not finish within the configured bound.
 * The in-flight slot has already been released when this is thrown.
 */
@Getter
public class LoadTimeoutException extends ModCacheException {

    private final String domain;
    private final Object key;
    private final Duration timeout;

    public LoadTimeoutException(String domain, Object key, Duration timeout) {
        super("Load of " + domain + "/" + key + " exceeded " + timeout.toMillis() + "ms");
        this.domain = domain;
        this.key = key;
        this.timeout = timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
