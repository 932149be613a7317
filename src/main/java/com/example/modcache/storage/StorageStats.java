package com.example.modcache.storage;

import java.util.Map;

/**
 * @param rowCounts row count per user table, ordered by table name
 */
public record StorageStats(
    long sizeBytes,
    long pageCount,
    long pageSize,
    String journalMode,
    int schemaVersion,
    Map<String, Long> rowCounts
) {
}
