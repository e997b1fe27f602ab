package com.entity.reconciliation.sql;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A pool-aware {@link SqlConnection} that borrows a connection per operation
 * and releases it when done.
 *
 * <p>{@link SqlQueryExecutor} and the stores use it like any other connection.
 * A transaction keeps one borrowed connection for its whole duration.</p>
 */
public class PooledSqlConnection implements SqlConnection {

    private final SqlConnectionPool pool;

    public PooledSqlConnection(SqlConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public void execute(String sql, List<Object> params) {
        SqlConnection conn = pool.borrow();
        try {
            conn.execute(sql, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        SqlConnection conn = pool.borrow();
        try {
            return conn.query(sql, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public void forEachRow(String sql, List<Object> params, RowVisitor visitor) {
        SqlConnection conn = pool.borrow();
        try {
            conn.forEachRow(sql, params, visitor);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public <T> T inTransaction(Function<SqlConnection, T> work) {
        SqlConnection conn = pool.borrow();
        try {
            return conn.inTransaction(work);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public boolean isConnected() {
        SqlConnection conn = pool.borrow();
        try {
            return conn.isConnected();
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public String getDatabaseName() {
        return pool.getConfig().getDatabasePath();
    }

    public SqlConnectionPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        // closes the pool itself
        pool.close();
    }
}
