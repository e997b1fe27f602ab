package com.entity.reconciliation.sql;

import com.entity.reconciliation.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * SQLite-specific implementation using the xerial JDBC driver, which ships with the
 * FTS5 full-text extension enabled.
 *
 * <p>A JDBC connection must not be shared between threads; pool instances through
 * {@link SimpleSqlConnectionPool} for concurrent use.</p>
 */
public class SqliteConnection implements SqlConnection {
    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final Connection connection;
    private final String databasePath;

    public SqliteConnection(String databasePath, boolean readOnly) {
        this.databasePath = databasePath;
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        config.enforceForeignKeys(false);
        try {
            this.connection = config.createConnection("jdbc:sqlite:" + databasePath);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot open SQLite database '" + databasePath + "'", e);
        }
        log.debug("SQLite connection opened: {} (readOnly={})", databasePath, readOnly);
    }

    @Override
    public void execute(String sql, List<Object> params) {
        log.debug("Executing: {}", sql);
        try (PreparedStatement stmt = prepare(sql, params)) {
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure(sql, e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        List<Map<String, Object>> results = new ArrayList<>();
        forEachRow(sql, params, results::add);
        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public void forEachRow(String sql, List<Object> params, RowVisitor visitor) {
        log.debug("Querying: {} params={}", sql, params.size());
        try (PreparedStatement stmt = prepare(sql, params);
             ResultSet rs = stmt.executeQuery()) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                if (!visitor.visit(row)) {
                    break;
                }
            }
        } catch (SQLException e) {
            throw failure(sql, e);
        }
    }

    @Override
    public <T> T inTransaction(Function<SqlConnection, T> work) {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw failure("BEGIN", e);
        }
        try {
            T result = work.apply(this);
            connection.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly();
            throw failure("COMMIT", e);
        } catch (RuntimeException e) {
            rollbackQuietly();
            throw e;
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("Error restoring auto-commit: {}", e.getMessage());
            }
        }
    }

    @Override
    public boolean isConnected() {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeQuery("SELECT 1").close();
            return true;
        } catch (SQLException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getDatabaseName() {
        return databasePath;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing SQLite connection", e);
        }
        log.debug("SQLite connection closed: {}", databasePath);
    }

    private PreparedStatement prepare(String sql, List<Object> params) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
        return stmt;
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Error rolling back transaction: {}", e.getMessage());
        }
    }

    private StoreUnavailableException failure(String sql, SQLException e) {
        return new StoreUnavailableException(
                "SQLite statement failed on '" + databasePath + "': " + e.getMessage()
                        + " [" + abbreviate(sql) + "]", e);
    }

    private static String abbreviate(String sql) {
        String flat = sql.replaceAll("\\s+", " ").trim();
        return flat.length() > 120 ? flat.substring(0, 117) + "..." : flat;
    }
}
