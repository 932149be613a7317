package com.example.modcache.error;

/**
 * Corruption or schema mismatch. Raised from startup paths and must stop the service
 * from serving traffic.
 */
public class StorageFatalException extends ModCacheException {

    public StorageFatalException(String message) {
        super(message);
    }

    public StorageFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
