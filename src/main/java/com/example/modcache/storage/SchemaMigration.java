package com.example.modcache.storage;

import java.util.List;
import java.util.Objects;

/**
 * One versioned schema step. Statements are static DDL and run together in one transaction.
 */
public record SchemaMigration(int version, String description, List<String> statements) {

    public SchemaMigration {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive: " + version);
        }
        Objects.requireNonNull(description, "description");
        statements = List.copyOf(statements);
    }

    public static SchemaMigration of(int version, String description, String... statements) {
        return new SchemaMigration(version, description, List.of(statements));
    }
}
