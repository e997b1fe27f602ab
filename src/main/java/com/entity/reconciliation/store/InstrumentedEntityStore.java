package com.entity.reconciliation.store;

import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.core.model.QueryResponse;
import com.entity.reconciliation.logging.LogContext;
import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.tracing.Span;
import com.entity.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decorates an {@link EntityStore} with metrics, a span per operation and an MDC log
 * context. Results and exceptions pass through unchanged.
 */
public class InstrumentedEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InstrumentedEntityStore.class);

    private final EntityStore delegate;
    private final String backend;
    private final MetricsService metrics;
    private final TracingService tracing;

    public InstrumentedEntityStore(EntityStore delegate, String backend,
                                   MetricsService metrics, TracingService tracing) {
        this.delegate = delegate;
        this.backend = backend;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Returns the wrapped store.
     */
    public EntityStore getDelegate() {
        return delegate;
    }

    public String getBackend() {
        return backend;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public String identifierNamespace() {
        return delegate.identifierNamespace();
    }

    @Override
    public String schemaNamespace() {
        return delegate.schemaNamespace();
    }

    @Override
    public String viewUrlTemplate() {
        return delegate.viewUrlTemplate();
    }

    @Override
    public Set<EntityType> types() {
        return delegate.types();
    }

    @Override
    public List<Property> propertiesFor(String typeId) {
        return delegate.propertiesFor(typeId);
    }

    @Override
    public Optional<Entity> getEntity(String id) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forLookup(id);
             Span span = tracing.startSpan("store.lookup", Map.of("store.backend", backend, "entity.id", id))) {
            try {
                Optional<Entity> result = delegate.getEntity(id);
                span.setAttribute("entity.found", result.isPresent() ? 1L : 0L);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                fail(span, "lookup", e);
                throw e;
            } finally {
                metrics.recordOperationDuration(backend, "lookup", Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        String correlationId = request != null && !request.id().isEmpty()
                ? request.id() : LogContext.generateCorrelationId();
        String type = request != null ? request.type() : "";
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forQuery(correlationId, type);
             Span span = tracing.startSpan("store.query", Map.of("store.backend", backend, "query.type", type))) {
            try {
                QueryResponse response = delegate.query(request);
                int count = response.results().size();
                metrics.recordCandidateCount(backend, count);
                if (count > 0 && response.results().get(0).match()) {
                    metrics.incrementConfidentMatch(backend);
                }
                span.setAttribute("query.results", count);
                if (count > 0) {
                    span.setAttribute("query.top_score", response.results().get(0).score());
                }
                span.setStatus(Span.SpanStatus.OK);
                log.debug("query.completed backend={} results={}", backend, count);
                return response;
            } catch (RuntimeException e) {
                fail(span, "query", e);
                throw e;
            } finally {
                metrics.recordOperationDuration(backend, "query", Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    @Override
    public List<Entity> queryPrefix(String text, int limit) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forPrefix(text);
             Span span = tracing.startSpan("store.prefix", Map.of("store.backend", backend))) {
            try {
                List<Entity> result = delegate.queryPrefix(text, limit);
                span.setAttribute("prefix.results", result.size());
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                fail(span, "prefix", e);
                throw e;
            } finally {
                metrics.recordOperationDuration(backend, "prefix", Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void fail(Span span, String operation, RuntimeException e) {
        span.recordException(e);
        span.setStatus(Span.SpanStatus.ERROR);
        metrics.incrementFailure(backend, operation, e.getClass().getSimpleName());
        log.warn("{}.failed backend={} error={}", operation, backend, e.getMessage());
    }
}
