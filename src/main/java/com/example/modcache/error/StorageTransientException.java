package com.example.modcache.error;

/**
 * Busy, locked or I/O failure against storage. Any open transaction has been rolled back;
 * retry and backoff are up to the caller.
 */
public class StorageTransientException extends ModCacheException {

    public StorageTransientException(String message) {
        super(message);
    }

    public StorageTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
