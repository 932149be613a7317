package com.example.modcache.storage;

import java.nio.file.Path;
import java.time.Instant;

public record BackupSnapshot(Path path, long sizeBytes, int schemaVersion, Instant createdAt) {
}
