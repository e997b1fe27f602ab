package com.entity.reconciliation.store;

import com.entity.reconciliation.core.model.QueryRequest;

/**
 * Input validation for store queries and the request boundary.
 * Stores accept any non-null text; the length cap applies to request parameters only.
 */
public final class InputSanitizer {

    /** Maximum allowed length of query and prefix text received over HTTP. */
    public static final int MAX_QUERY_LENGTH = 1000;

    /** Maximum allowed length of a value bound into SQL. */
    public static final int MAX_SQL_VALUE_LENGTH = 4000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a query request.
     *
     * @param request the query
     * @throws IllegalArgumentException if the request or its text is null, or the limit is negative
     */
    public static void validateQuery(QueryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Query request must not be null");
        }
        validateText(request.text());
        if (request.limit() != null && request.limit() < 0) {
            throw new IllegalArgumentException("Limit must be >= 0, was " + request.limit());
        }
    }

    /**
     * Validates query or prefix text.
     *
     * @throws IllegalArgumentException if the text is null
     */
    public static void validateText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Query text must not be null");
        }
    }

    /**
     * Checks text received in a request parameter against {@link #MAX_QUERY_LENGTH}.
     *
     * @throws IllegalArgumentException if the text is too long
     */
    public static void checkRequestLength(String text) {
        if (text != null && text.length() > MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException(
                    "Query text exceeds maximum length of " + MAX_QUERY_LENGTH +
                            " characters (was " + text.length() + ")");
        }
    }

    /**
     * Validates a string value for binding into a SQL statement.
     *
     * @throws IllegalArgumentException if the value exceeds the maximum length
     */
    public static void sanitizeForSql(String value) {
        if (value != null && value.length() > MAX_SQL_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum SQL string length of " + MAX_SQL_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }
}
