package com.example.modcache.error;

/**
 * Root of the unchecked failures raised by the cache, limiter and storage layers.
 */
public class ModCacheException extends RuntimeException {

    public ModCacheException(String message) {
        super(message);
    }

    public ModCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return true when the caller may retry the same operation later
     */
    public boolean isRetryable() {
        return false;
    }
}
