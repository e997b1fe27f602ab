package com.entity.reconciliation.loader;

import com.entity.reconciliation.PeopleFixture;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.memory.InMemoryEntityStore;
import com.entity.reconciliation.metrics.MicrometerMetricsService;
import com.entity.reconciliation.sql.PooledSqlConnection;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InstrumentedEntityStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EntityStoresTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Locations mentioning sqlite should select the relational backend")
    void isRelational() {
        assertTrue(EntityStores.isRelational("/data/people.sqlite"));
        assertTrue(EntityStores.isRelational("/data/SQLite/people.db"));
        assertFalse(EntityStores.isRelational("/data/people.tsv.gz"));
    }

    @Test
    @DisplayName("Should open a flat file as an instrumented in-memory store")
    void openFlatFile() throws IOException {
        Path tsv = tempDir.resolve("people.tsv");
        try (InputStream in = getClass().getResourceAsStream(PeopleFixture.RESOURCE)) {
            Files.copy(in, tsv);
        }

        try (EntityStore store = EntityStores.open(tsv.toString(), StoreOptions.defaults())) {
            InstrumentedEntityStore instrumented = assertInstanceOf(InstrumentedEntityStore.class, store);
            assertEquals("memory", instrumented.getBackend());
            assertInstanceOf(InMemoryEntityStore.class, instrumented.getDelegate());
            assertEquals(1, store.query(QueryRequest.of("q42")).results().size());
        }
    }

    @Test
    @DisplayName("Should open a SQLite database through a read-only pool")
    void openRelational() throws IOException {
        Path db = PeopleFixture.writeDatabase(tempDir);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StoreOptions options = StoreOptions.builder()
                .maxConnections(2)
                .metricsService(new MicrometerMetricsService(registry))
                .build();

        try (EntityStore store = EntityStores.open(db.toString(), options)) {
            InstrumentedEntityStore instrumented = assertInstanceOf(InstrumentedEntityStore.class, store);
            assertEquals("sqlite", instrumented.getBackend());
            RelationalEntityStore relational = assertInstanceOf(RelationalEntityStore.class, instrumented.getDelegate());
            PooledSqlConnection pooled = assertInstanceOf(PooledSqlConnection.class, relational.getConnection());
            assertEquals(2, pooled.getPool().getConfig().getMaxTotal());
            assertTrue(pooled.getPool().getConfig().isReadOnly());

            assertEquals("person:q42", store.query(QueryRequest.of("q42")).results().get(0).id());
            assertEquals(1, registry.get("reconciliation.operation.duration")
                    .tag("backend", "sqlite").tag("operation", "query").timer().count());
        }
    }

    @Test
    @DisplayName("Missing database should fail with NoSuchFileException")
    void missingDatabase() {
        String location = tempDir.resolve("missing.sqlite").toString();
        assertThrows(NoSuchFileException.class, () -> EntityStores.open(location, StoreOptions.defaults()));
    }

    @Test
    @DisplayName("Missing flat file should fail with an IOException")
    void missingFlatFile() {
        String location = tempDir.resolve("missing.tsv").toString();
        assertThrows(IOException.class, () -> EntityStores.open(location, StoreOptions.defaults()));
    }

    @Test
    @DisplayName("Options should reject non-positive limits")
    void invalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> StoreOptions.builder().maxConnections(0));
        assertThrows(IllegalArgumentException.class, () -> StoreOptions.builder().maxWaitMillis(0));
    }
}
