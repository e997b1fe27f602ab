package com.entity.reconciliation.loader;

import com.entity.reconciliation.logging.LogContext;
import com.entity.reconciliation.memory.InMemoryEntityStore;
import com.entity.reconciliation.sql.PoolConfig;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InstrumentedEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens the store a location points to. Locations containing {@code sqlite} are SQLite
 * databases read through the relational engine; anything else is a flat file loaded
 * into memory.
 */
public final class EntityStores {
    private static final Logger log = LoggerFactory.getLogger(EntityStores.class);

    static final String SQLITE_MARKER = "sqlite";

    private EntityStores() {
        // utility class
    }

    /**
     * Opens a store, instrumented with the metrics and tracing of the options.
     *
     * @param location flat file path or SQLite database path
     * @param options  connection, cache and instrumentation settings
     * @return the opened store
     * @throws IOException              if a flat file cannot be read
     * @throws IllegalArgumentException if a flat file is malformed
     */
    public static EntityStore open(String location, StoreOptions options) throws IOException {
        try (LogContext ignored = LogContext.forLoad(location)) {
            if (isRelational(location)) {
                return new InstrumentedEntityStore(openRelational(location, options), "sqlite",
                        options.getMetricsService(), options.getTracingService());
            }
            return new InstrumentedEntityStore(openFlatFile(Path.of(location)), "memory",
                    options.getMetricsService(), options.getTracingService());
        }
    }

    public static boolean isRelational(String location) {
        return location.toLowerCase(Locale.ROOT).contains(SQLITE_MARKER);
    }

    /**
     * Loads a flat file into an {@link InMemoryEntityStore}.
     */
    public static InMemoryEntityStore openFlatFile(Path path) throws IOException {
        FlatFile file = new FlatFileReader().read(path);
        return new InMemoryEntityStore(file.metadata(), file.records().iterator());
    }

    /**
     * Opens an existing SQLite database read-only.
     */
    public static RelationalEntityStore openRelational(String location, StoreOptions options) throws IOException {
        if (!Files.isRegularFile(Path.of(location))) {
            throw new NoSuchFileException(location);
        }
        int maxTotal = options.getMaxConnections();
        PoolConfig poolConfig = PoolConfig.builder()
                .databasePath(location)
                .readOnly(true)
                .maxTotal(maxTotal)
                .maxIdle(maxTotal)
                .minIdle(1)
                .maxWaitMillis(options.getMaxWaitMillis())
                .build();
        log.info("store.open.relational location={} maxConnections={}", location, maxTotal);
        return RelationalEntityStore.builder()
                .pool(poolConfig)
                .cacheConfig(options.getCacheConfig())
                .metrics(options.getMetricsService())
                .build();
    }
}
