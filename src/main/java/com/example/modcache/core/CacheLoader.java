package com.example.modcache.core;

/**
 * Produces the value for a key that missed the cache. Usually backed by a storage query.
 */
@FunctionalInterface
public interface CacheLoader<V> {
    V load() throws Exception;
}
