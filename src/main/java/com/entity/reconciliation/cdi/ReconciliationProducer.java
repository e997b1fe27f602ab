package com.entity.reconciliation.cdi;

import com.entity.reconciliation.api.ReconciliationOptions;
import com.entity.reconciliation.api.ReconciliationService;
import com.entity.reconciliation.cache.CacheConfig;
import com.entity.reconciliation.loader.EntityStores;
import com.entity.reconciliation.loader.StoreOptions;
import com.entity.reconciliation.store.EntityStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * CDI producer that opens the entity store and the reconciliation service from
 * MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * reconciliation.source.location=/data/people.tsv.gz
 * </pre>
 * <p>A location containing {@code sqlite} is opened as a SQLite database; anything else
 * is loaded into memory as a flat file. Defaults for the remaining keys are in
 * {@code META-INF/microprofile-config.properties}.</p>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Source ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.source.location")
    String sourceLocation;

    // ── Service ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.service.public-url", defaultValue = "http://localhost:8080")
    String publicUrl;

    @Inject
    @ConfigProperty(name = "reconciliation.service.suggest-limit", defaultValue = "25")
    int suggestLimit;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.pool.max-total", defaultValue = "8")
    int poolMaxTotal;

    @Inject
    @ConfigProperty(name = "reconciliation.pool.max-wait-millis", defaultValue = "5000")
    long poolMaxWaitMillis;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "reconciliation.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "reconciliation.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    @Produces
    @ApplicationScoped
    public EntityStore entityStore() {
        StoreOptions options = StoreOptions.builder()
                .maxConnections(poolMaxTotal)
                .maxWaitMillis(poolMaxWaitMillis)
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled())
                .build();
        log.info("Producing EntityStore: location={} relational={}",
                sourceLocation, EntityStores.isRelational(sourceLocation));
        try {
            return EntityStores.open(sourceLocation, options);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open entity source " + sourceLocation, e);
        }
    }

    public void closeStore(@Disposes EntityStore store) {
        log.info("Closing EntityStore '{}'", store.name());
        store.close();
    }

    @Produces
    @ApplicationScoped
    public ReconciliationOptions reconciliationOptions() {
        return ReconciliationOptions.builder()
                .publicUrl(publicUrl)
                .suggestLimit(suggestLimit)
                .build();
    }

    @Produces
    @ApplicationScoped
    public ReconciliationService reconciliationService(EntityStore store, ReconciliationOptions options) {
        return new ReconciliationService(store, options);
    }
}
