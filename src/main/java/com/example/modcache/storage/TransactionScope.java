package com.example.modcache.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Handle passed to transactional work. Every value goes through a bound parameter; there is
 * no way to run SQL with inlined arguments from here.
 */
public final class TransactionScope {

    private final JdbcTemplate jdbc;

    TransactionScope(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int update(String sql, Object... params) {
        return jdbc.update(sql, params);
    }

    public int[] batchUpdate(String sql, List<Object[]> batchParams) {
        return jdbc.batchUpdate(sql, batchParams);
    }

    public List<Map<String, Object>> query(String sql, Object... params) {
        return jdbc.queryForList(sql, params);
    }

    public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... params) {
        return jdbc.query(sql, rowMapper, params);
    }

    public <T> Optional<T> queryForOptional(String sql, Class<T> type, Object... params) {
        return Optional.ofNullable(DataAccessUtils.singleResult(jdbc.queryForList(sql, type, params)));
    }

    /**
     * Rowid of the last row inserted on this transaction's connection.
     */
    public long lastInsertRowId() {
        Long id = jdbc.queryForObject("SELECT last_insert_rowid()", Long.class);
        return id == null ? 0L : id;
    }
}
