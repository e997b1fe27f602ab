package com.entity.reconciliation.sql;

/**
 * Borrow/release access to a bounded set of {@link SqlConnection}s, so that
 * concurrent queries never share a JDBC connection.
 */
public interface SqlConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection, waiting up to the configured timeout.
     *
     * @throws IllegalStateException if the pool is closed or the wait times out
     */
    SqlConnection borrow();

    /**
     * Hands a borrowed connection back.
     */
    void release(SqlConnection connection);

    PoolStats getStats();

    /**
     * The configuration the pool was built with.
     */
    PoolConfig getConfig();

    @Override
    void close();
}
