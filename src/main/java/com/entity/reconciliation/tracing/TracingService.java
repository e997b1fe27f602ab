package com.entity.reconciliation.tracing;

import java.util.Map;

/**
 * Starts spans around store operations. {@link NoOpTracingService} is used when no
 * tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
