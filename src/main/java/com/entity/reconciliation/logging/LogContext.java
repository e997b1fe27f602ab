package com.entity.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(queryId, "person")) {
 *     log.info("query.completed results={}", results.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a reconciliation query.
     */
    public static LogContext forQuery(String correlationId, String entityType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityType", entityType);
        ctx.put("operation", "query");
        return ctx;
    }

    /**
     * Creates a log context for a prefix (autocomplete) query.
     */
    public static LogContext forPrefix(String prefix) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("prefix", prefix);
        ctx.put("operation", "prefix");
        return ctx;
    }

    /**
     * Creates a log context for an entity lookup by id.
     */
    public static LogContext forLookup(String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("entityId", entityId);
        ctx.put("operation", "lookup");
        return ctx;
    }

    /**
     * Creates a log context for loading a store from a location.
     */
    public static LogContext forLoad(String location) {
        LogContext ctx = new LogContext();
        ctx.put("location", location);
        ctx.put("operation", "load");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
