package com.entity.reconciliation.tracing;

/**
 * A traced unit of work, ended by {@link #close()}.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("store.query")) {
 *     span.setAttribute("query.type", "person");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
