package com.example.modcache.storage;

/**
 * Unit of work run inside {@link StorageAccessor#transaction(TransactionWork)}. Throwing
 * rolls the whole unit back.
 */
@FunctionalInterface
public interface TransactionWork<T> {
    T execute(TransactionScope tx);
}
