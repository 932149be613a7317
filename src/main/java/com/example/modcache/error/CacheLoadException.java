package com.example.modcache.error;

/**
 * A loader failed with a checked exception. Nothing was cached for the key.
 */
public class CacheLoadException extends ModCacheException {

    public CacheLoadException(String domain, Object key, Throwable cause) {
        super("Load of " + domain + "/" + key + " failed: " + cause.getMessage(), cause);
    }
}
