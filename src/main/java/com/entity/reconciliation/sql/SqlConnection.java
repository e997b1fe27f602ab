package com.entity.reconciliation.sql;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Interface for relational database access.
 * Abstracts the underlying JDBC driver; parameters are always bound positionally,
 * never interpolated into the statement text.
 *
 * <p>Failures surface as {@link com.entity.reconciliation.store.StoreUnavailableException}.</p>
 */
public interface SqlConnection extends AutoCloseable {

    /**
     * Executes a statement that modifies the database.
     *
     * @param sql    the statement
     * @param params positional parameters
     */
    void execute(String sql, List<Object> params);

    /**
     * Executes a statement without parameters.
     */
    default void execute(String sql) {
        execute(sql, List.of());
    }

    /**
     * Executes a query and returns all rows.
     *
     * @param sql    the query
     * @param params positional parameters
     * @return rows as column label to value maps, in result order
     */
    List<Map<String, Object>> query(String sql, List<Object> params);

    /**
     * Executes a query without parameters and returns all rows.
     */
    default List<Map<String, Object>> query(String sql) {
        return query(sql, List.of());
    }

    /**
     * Executes a query and hands rows to a visitor until it asks to stop.
     *
     * @param sql     the query
     * @param params  positional parameters
     * @param visitor receives each row in result order
     */
    void forEachRow(String sql, List<Object> params, RowVisitor visitor);

    /**
     * Runs work inside a single transaction, committing when it returns and rolling
     * back when it throws.
     */
    <T> T inTransaction(Function<SqlConnection, T> work);

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    /**
     * Gets the name (file path) of the database in use.
     */
    String getDatabaseName();

    @Override
    void close();

    /**
     * Receives query rows one by one.
     */
    @FunctionalInterface
    interface RowVisitor {

        /**
         * @param row the current row
         * @return true to receive the next row, false to stop
         */
        boolean visit(Map<String, Object> row);
    }
}
