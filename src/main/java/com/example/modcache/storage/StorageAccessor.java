package com.example.modcache.storage;

import com.example.modcache.error.StorageFatalException;
import com.example.modcache.error.StorageTransientException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Shared handle to the SQLite database.
 *
 * <p>The database runs in WAL mode. All writes go through one dedicated connection and are
 * serialized by a fair lock, so at most one write transaction is in flight. Reads use a
 * separate pool of query-only connections and see only committed data; they are never blocked
 * by the writer.
 *
 * <p>Opened once at startup and closed at shutdown; {@link #close()} checkpoints the WAL
 * before releasing the connections.
 */
@Slf4j
public class StorageAccessor implements AutoCloseable {

    private static final String CREATE_MIGRATIONS_TABLE =
        "CREATE TABLE IF NOT EXISTS schema_migrations ("
            + " version INTEGER PRIMARY KEY,"
            + " description TEXT NOT NULL,"
            + " applied_at TEXT NOT NULL)";

    private final StorageSettings settings;
    private final List<SchemaMigration> migrations;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final SingleConnectionDataSource writerDataSource;
    private final JdbcTemplate writerJdbc;
    private final TransactionTemplate transactionTemplate;
    private final HikariDataSource readerPool;
    private final JdbcTemplate readerJdbc;

    public StorageAccessor(StorageSettings settings, List<SchemaMigration> migrations, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.migrations = sortedAndChecked(migrations);

        String url = "jdbc:sqlite:" + settings.path().toAbsolutePath();
        SingleConnectionDataSource writer = null;
        try {
            writer = new SingleConnectionDataSource(openWriter(url), true);
            this.readerPool = openReaders(url);
        } catch (SQLException | RuntimeException e) {
            if (writer != null) {
                writer.destroy();
            }
            log.error("Cannot open database {}", settings.path(), e);
            throw new StorageFatalException("Cannot open database " + settings.path(), e);
        }
        this.writerDataSource = writer;
        this.writerJdbc = new JdbcTemplate(writerDataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(writerDataSource));
        this.readerJdbc = new JdbcTemplate(readerPool);

        log.info("Storage opened: path={}, readers={}", settings.path(), settings.readerPoolSize());
    }

    /**
     * Read-only query. Runs on the reader pool, concurrently with other reads and with an
     * in-progress write.
     */
    public List<Map<String, Object>> execute(String sql, Object... params) {
        ensureOpen();
        try {
            return readerJdbc.queryForList(sql, params);
        } catch (DataAccessException e) {
            throw SqliteErrorClassifier.translate("query", e);
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... params) {
        ensureOpen();
        try {
            return readerJdbc.query(sql, rowMapper, params);
        } catch (DataAccessException e) {
            throw SqliteErrorClassifier.translate("query", e);
        }
    }

    /**
     * Runs {@code work} as one transaction on the writer connection. Commits if it returns,
     * rolls back if it throws. The write lock is released on every path.
     *
     * @throws StorageTransientException busy, locked or I/O failure, or the write lock could
     *     not be obtained in time; nothing was committed
     */
    public <T> T transaction(TransactionWork<T> work) {
        Objects.requireNonNull(work, "work");
        ensureOpen();
        acquireOpenWriteLock();
        try {
            return transactionTemplate.execute(status -> work.execute(new TransactionScope(writerJdbc)));
        } catch (RuntimeException e) {
            log.warn("Transaction rolled back: {}", e.toString());
            throw SqliteErrorClassifier.translate("transaction", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Brings the schema up to {@code targetVersion}, applying only the steps above the stored
     * version. Each step commits together with its {@code schema_migrations} row, so calling
     * this again is a no-op.
     *
     * @throws StorageFatalException integrity check failure, a stored version newer than this
     *     build knows, or a failing step
     */
    public void migrate(int targetVersion) {
        int latest = latestKnownVersion();
        if (targetVersion < 1 || targetVersion > latest) {
            throw new IllegalArgumentException(
                "targetVersion must be between 1 and " + latest + ": " + targetVersion);
        }
        ensureOpen();
        acquireOpenWriteLock();
        try {
            verifyIntegrity();
            writerJdbc.execute(CREATE_MIGRATIONS_TABLE);

            int current = storedVersion(writerJdbc);
            if (current > latest) {
                log.error("Database schema v{} is newer than supported v{}", current, latest);
                throw new StorageFatalException(
                    "Database schema v" + current + " is newer than supported v" + latest);
            }
            if (current >= targetVersion) {
                log.debug("Schema already at v{} (target v{})", current, targetVersion);
                return;
            }
            for (SchemaMigration migration : migrations) {
                if (migration.version() > current && migration.version() <= targetVersion) {
                    apply(migration);
                }
            }
        } catch (DataAccessException e) {
            log.error("Schema migration failed", e);
            throw new StorageFatalException("Schema migration failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    public int currentSchemaVersion() {
        ensureOpen();
        try {
            Integer tables = readerJdbc.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
                Integer.class, "schema_migrations");
            if (tables == null || tables == 0) {
                return 0;
            }
            return storedVersion(readerJdbc);
        } catch (DataAccessException e) {
            throw SqliteErrorClassifier.translate("schema version lookup", e);
        }
    }

    public int latestKnownVersion() {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).version();
    }

    /**
     * Writes a consistent copy of the database to {@code target}. Runs on the writer
     * connection, so it waits for an in-flight write; readers are unaffected.
     */
    public BackupSnapshot backup(Path target) {
        Objects.requireNonNull(target, "target");
        Path absolute = target.toAbsolutePath();
        if (Files.exists(absolute)) {
            throw new IllegalArgumentException("Backup target already exists: " + absolute);
        }
        ensureOpen();
        acquireOpenWriteLock();
        try {
            writerJdbc.update("VACUUM INTO ?", absolute.toString());
        } catch (DataAccessException e) {
            throw SqliteErrorClassifier.translate("backup", e);
        } finally {
            writeLock.unlock();
        }

        try {
            BackupSnapshot snapshot = new BackupSnapshot(
                absolute, Files.size(absolute), currentSchemaVersion(), clock.instant());
            log.info("Backup written: path={}, bytes={}", absolute, snapshot.sizeBytes());
            return snapshot;
        } catch (IOException e) {
            throw new StorageTransientException("Backup written but unreadable: " + absolute, e);
        }
    }

    public StorageStats stats() {
        ensureOpen();
        try {
            long pageCount = readLong("PRAGMA page_count");
            long pageSize = readLong("PRAGMA page_size");
            String journalMode = readerJdbc.queryForObject("PRAGMA journal_mode", String.class);

            List<String> tables = readerJdbc.queryForList(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name",
                String.class);
            Map<String, Long> rowCounts = new LinkedHashMap<>();
            for (String table : tables) {
                // table names come from sqlite_master, not from callers
                rowCounts.put(table, readLong("SELECT COUNT(*) FROM " + quoteIdentifier(table)));
            }
            return new StorageStats(pageCount * pageSize, pageCount, pageSize, journalMode,
                currentSchemaVersion(), rowCounts);
        } catch (DataAccessException e) {
            throw SqliteErrorClassifier.translate("stats", e);
        }
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Waits for any in-flight write, checkpoints the WAL into the main file and releases all
     * connections. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writeLock.lock();
        try {
            readerPool.close();
            writerJdbc.queryForList("PRAGMA wal_checkpoint(TRUNCATE)");
        } catch (DataAccessException e) {
            log.warn("WAL checkpoint on close failed; SQLite will replay the log on next open", e);
        } finally {
            writerDataSource.destroy();
            writeLock.unlock();
            log.info("Storage closed: path={}", settings.path());
        }
    }

    private void apply(SchemaMigration migration) {
        transactionTemplate.executeWithoutResult(status -> {
            for (String statement : migration.statements()) {
                writerJdbc.execute(statement);
            }
            writerJdbc.update(
                "INSERT INTO schema_migrations (version, description, applied_at) VALUES (?, ?, ?)",
                migration.version(), migration.description(), clock.instant().toString());
        });
        log.info("Applied schema migration v{}: {}", migration.version(), migration.description());
    }

    private void verifyIntegrity() {
        List<String> result = writerJdbc.queryForList("PRAGMA quick_check", String.class);
        if (result.size() != 1 || !"ok".equalsIgnoreCase(result.get(0))) {
            log.error("Integrity check failed for {}: {}", settings.path(), result);
            throw new StorageFatalException("Integrity check failed for " + settings.path() + ": " + result);
        }
    }

    private void acquireWriteLock() {
        long waitMillis = settings.writeLockTimeout().toMillis();
        try {
            if (!writeLock.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new StorageTransientException("Write lock not acquired within " + waitMillis + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageTransientException("Interrupted while waiting for the write lock", e);
        }
    }

    /**
     * Takes the write lock and re-checks that storage is still open. {@link #close()} marks the
     * accessor closed before it queues for the lock, so a writer that passed the first check may
     * still be waiting when close starts. It must not run, whether it is served before or after
     * close.
     */
    private void acquireOpenWriteLock() {
        acquireWriteLock();
        if (closed.get()) {
            writeLock.unlock();
            throw new IllegalStateException("Storage is closed: " + settings.path());
        }
    }

    int queuedWriters() {
        return writeLock.getQueueLength();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Storage is closed: " + settings.path());
        }
    }

    private long readLong(String sql) {
        Long value = readerJdbc.queryForObject(sql, Long.class);
        return value == null ? 0L : value;
    }

    private Connection openWriter(String url) throws SQLException {
        SQLiteConfig config = baseConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url);
        return dataSource.getConnection();
    }

    private HikariDataSource openReaders(String url) {
        // journal mode is persistent in the file; the writer already switched it to WAL
        SQLiteDataSource dataSource = new SQLiteDataSource(baseConfig());
        dataSource.setUrl(url);

        HikariConfig config = new HikariConfig();
        config.setDataSource(dataSource);
        config.setPoolName("modcache-readers");
        config.setMaximumPoolSize(settings.readerPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionInitSql("PRAGMA query_only = ON");
        config.setConnectionTimeout(Math.max(250L, settings.busyTimeout().toMillis()));
        return new HikariDataSource(config);
    }

    private SQLiteConfig baseConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout((int) settings.busyTimeout().toMillis());
        return config;
    }

    private static int storedVersion(JdbcTemplate jdbc) {
        Integer version = jdbc.queryForObject("SELECT COALESCE(MAX(version), 0) FROM schema_migrations", Integer.class);
        return version == null ? 0 : version;
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static List<SchemaMigration> sortedAndChecked(List<SchemaMigration> migrations) {
        Objects.requireNonNull(migrations, "migrations");
        List<SchemaMigration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(SchemaMigration::version));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).version() == sorted.get(i - 1).version()) {
                throw new IllegalArgumentException("Duplicate migration version " + sorted.get(i).version());
            }
        }
        return List.copyOf(sorted);
    }
}
