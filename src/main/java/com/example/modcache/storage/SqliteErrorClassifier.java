package com.example.modcache.storage;

import com.example.modcache.error.StorageFatalException;
import com.example.modcache.error.StorageTransientException;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Maps storage failures onto the transient / fatal split. Anything it does not recognise is
 * returned unchanged.
 */
final class SqliteErrorClassifier {

    private static final Set<SQLiteErrorCode> TRANSIENT = EnumSet.of(
        SQLiteErrorCode.SQLITE_BUSY,
        SQLiteErrorCode.SQLITE_LOCKED,
        SQLiteErrorCode.SQLITE_IOERR,
        SQLiteErrorCode.SQLITE_FULL,
        SQLiteErrorCode.SQLITE_PROTOCOL);

    private static final Set<SQLiteErrorCode> FATAL = EnumSet.of(
        SQLiteErrorCode.SQLITE_CORRUPT,
        SQLiteErrorCode.SQLITE_NOTADB);

    private SqliteErrorClassifier() {
    }

    static RuntimeException translate(String action, RuntimeException e) {
        SQLiteErrorCode primary = primaryCode(e);
        if (primary != null && FATAL.contains(primary)) {
            return new StorageFatalException(action + " failed, database is unusable: " + primary, e);
        }
        if (primary != null && TRANSIENT.contains(primary)) {
            return new StorageTransientException(action + " failed: " + primary, e);
        }
        if (e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException) {
            return new StorageTransientException(action + " failed: " + e.getMessage(), e);
        }
        return e;
    }

    private static SQLiteErrorCode primaryCode(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException) {
                // extended codes carry the primary code in the low byte
                return SQLiteErrorCode.getErrorCode(((SQLiteException) t).getResultCode().code & 0xFF);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
