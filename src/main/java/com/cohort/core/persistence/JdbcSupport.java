package com.cohort.core.persistence;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared plumbing for the JDBC repositories: parameter binding, row mapping and
 * explicit transactions over a plain {@link DataSource}.
 * <p>
 * Enum values are stored lower-case, {@link Instant}s as {@link Timestamp}s.
 */
public abstract class JdbcSupport {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface TransactionCallback<T> {
        T doInTransaction(Connection conn) throws SQLException;
    }

    protected final DataSource dataSource;

    protected JdbcSupport(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    protected <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        try (Connection conn = dataSource.getConnection()) {
            return query(conn, sql, mapper, params);
        } catch (SQLException e) {
            throw new PersistenceException("Query failed: " + firstLine(sql), e);
        }
    }

    protected <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        }
    }

    protected <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    protected int count(String sql, Object... params) {
        return queryOne(sql, rs -> rs.getInt(1), params).orElse(0);
    }

    protected int update(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection()) {
            return update(conn, sql, params);
        } catch (SQLException e) {
            throw new PersistenceException("Update failed: " + firstLine(sql), e);
        }
    }

    protected int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        }
    }

    /**
     * Runs {@code callback} on one connection with auto-commit off; commits on success,
     * rolls back on any exception.
     */
    protected <T> T inTransaction(TransactionCallback<T> callback) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = callback.doInTransaction(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Transaction failed", e);
        }
    }

    // ── Column helpers ───────────────────────────────────────────────────

    protected static String enumValue(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }

    protected static <E extends Enum<E>> E enumColumn(ResultSet rs, String column, Class<E> type)
            throws SQLException {
        String raw = rs.getString(column);
        return raw == null ? null : Enum.valueOf(type, raw.toUpperCase(Locale.ROOT));
    }

    protected static Instant instantColumn(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    protected static Double doubleColumn(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param instanceof Instant instant) {
                stmt.setTimestamp(i + 1, Timestamp.from(instant));
            } else if (param instanceof Enum<?> e) {
                stmt.setString(i + 1, enumValue(e));
            } else {
                stmt.setObject(i + 1, param);
            }
        }
    }

    private static String firstLine(String sql) {
        String trimmed = sql.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl);
    }
}
