package com.chatrelay.server.store.jdbc;

import com.chatrelay.server.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;

/**
 * Shared plumbing of the JDBC adapters: UUID binding, existence queries and the
 * SQLException to StoreException translation.
 */
abstract class JdbcDao {
    private static final Logger log = LoggerFactory.getLogger(JdbcDao.class);

    @FunctionalInterface
    protected interface TxWork<T> {
        T run(Connection conn) throws SQLException;
    }

    protected final DataSource dataSource;

    protected JdbcDao(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    protected static void setUuid(PreparedStatement ps, int index, String id) throws SQLException {
        if (id == null) {
            ps.setNull(index, Types.OTHER);
        } else {
            ps.setObject(index, UUID.fromString(id));
        }
    }

    protected static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant);
    }

    protected static String iso(Timestamp ts) {
        return ts == null ? null : ts.toInstant().toString();
    }

    /** Runs a query whose parameters are all UUIDs and reports whether it returned a row. */
    protected boolean exists(String sql, String... ids) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < ids.length; i++) {
                setUuid(ps, i + 1, ids[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + sql, e);
        }
    }

    /**
     * Runs {@code work} in one transaction. Any failure rolls everything back;
     * SQL errors come out as {@link StoreException}, other exceptions unchanged.
     */
    protected <T> T inTransaction(String operation, TxWork<T> work) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly(conn, e);
            throw new StoreException(operation + " failed", e);
        } catch (RuntimeException e) {
            if (conn != null) {
                try {
                    conn.rollback();
                } catch (SQLException ex) {
                    e.addSuppressed(ex);
                }
            }
            throw e;
        } finally {
            try {
                release(conn);
            } catch (SQLException e) {
                log.warn("Failed to close connection", e);
            }
        }
    }

    protected static void rollbackQuietly(Connection conn, SQLException cause) {
        if (conn == null) return;
        try {
            conn.rollback();
        } catch (SQLException ex) {
            cause.addSuppressed(ex);
        }
    }

    protected static void release(Connection conn) throws SQLException {
        if (conn == null) return;
        try {
            conn.setAutoCommit(true);
        } finally {
            conn.close();
        }
    }
}
