package com.example.modcache.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * @param path database file; created if missing
 * @param readerPoolSize connections serving concurrent reads
 * @param busyTimeout how long SQLite waits on a locked database before failing
 * @param writeLockTimeout how long a writer waits for the single write slot
 */
public record StorageSettings(Path path, int readerPoolSize, Duration busyTimeout, Duration writeLockTimeout) {

    public StorageSettings {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(busyTimeout, "busyTimeout");
        Objects.requireNonNull(writeLockTimeout, "writeLockTimeout");
        if (readerPoolSize <= 0) {
            throw new IllegalArgumentException("readerPoolSize must be positive: " + readerPoolSize);
        }
        if (busyTimeout.isNegative() || writeLockTimeout.isNegative() || writeLockTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
    }

    public static StorageSettings defaults(Path path) {
        return new StorageSettings(path, 4, Duration.ofSeconds(5), Duration.ofSeconds(10));
    }
}
