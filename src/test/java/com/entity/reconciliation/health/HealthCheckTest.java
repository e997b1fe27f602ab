package com.entity.reconciliation.health;

import com.entity.reconciliation.PeopleFixture;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.memory.InMemoryEntityStore;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.sql.PoolConfig;
import com.entity.reconciliation.sql.PoolStats;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.sql.SqlConnection;
import com.entity.reconciliation.sql.SqlConnectionPool;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InstrumentedEntityStore;
import com.entity.reconciliation.store.StoreUnavailableException;
import com.entity.reconciliation.tracing.NoOpTracingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("up() should create UP status")
        void upFactory() {
            HealthStatus status = HealthStatus.up();
            assertTrue(status.isUp());
            assertFalse(status.isDown());
            assertEquals("OK", status.message());
        }

        @Test
        @DisplayName("down() should create DOWN status with reason")
        void downFactory() {
            HealthStatus status = HealthStatus.down("Database unreachable");
            assertTrue(status.isDown());
            assertFalse(status.isUp());
            assertEquals("Database unreachable", status.message());
        }

        @Test
        @DisplayName("withDetail() should add key-value detail without changing the original")
        void withDetail() {
            HealthStatus base = HealthStatus.degraded("slow");
            HealthStatus status = base.withDetail("latencyMs", 42L).withDetail("database", "people.sqlite");

            assertEquals(42L, status.details().get("latencyMs"));
            assertEquals("people.sqlite", status.details().get("database"));
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertTrue(base.details().isEmpty());
        }
    }

    @Nested
    @DisplayName("StoreHealthCheck")
    class StoreHealthCheckTests {

        @Test
        @DisplayName("Store with types should be UP")
        void storeUp() {
            HealthStatus status = new StoreHealthCheck(PeopleFixture.memoryStore()).check();

            assertTrue(status.isUp());
            assertEquals(3, status.details().get("types"));
            assertEquals("People of Letters", status.details().get("name"));
        }

        @Test
        @DisplayName("Store without types should be DEGRADED")
        void storeWithoutTypes() {
            EntityStore store = mock(EntityStore.class);
            when(store.types()).thenReturn(Set.of());
            when(store.name()).thenReturn("empty");

            assertEquals(HealthStatus.Status.DEGRADED, new StoreHealthCheck(store).check().status());
        }

        @Test
        @DisplayName("Failing store should be DOWN")
        void storeFailing() {
            EntityStore store = mock(EntityStore.class);
            when(store.types()).thenThrow(new StoreUnavailableException("gone", null));

            HealthStatus status = new StoreHealthCheck(store).check();
            assertTrue(status.isDown());
            assertEquals("StoreUnavailableException", status.details().get("error"));
        }
    }

    @Nested
    @DisplayName("DatabaseHealthCheck")
    class DatabaseHealthCheckTests {

        @Test
        @DisplayName("Successful ping should be UP with latency")
        void pingUp() {
            SqlConnection conn = mock(SqlConnection.class);
            when(conn.query(anyString())).thenReturn(List.of(Map.of("ok", 1)));
            when(conn.getDatabaseName()).thenReturn("people.sqlite");

            HealthStatus status = new DatabaseHealthCheck(conn).check();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("latencyMs"));
            assertEquals("people.sqlite", status.details().get("database"));
        }

        @Test
        @DisplayName("Failing ping should be DOWN")
        void pingDown() {
            SqlConnection conn = mock(SqlConnection.class);
            when(conn.query(anyString())).thenThrow(new StoreUnavailableException("disk I/O error", null));

            HealthStatus status = new DatabaseHealthCheck(conn).check();

            assertTrue(status.isDown());
            assertTrue(status.message().contains("disk I/O error"));
        }
    }

    @Nested
    @DisplayName("ConnectionPoolHealthCheck")
    class ConnectionPoolHealthCheckTests {

        private SqlConnectionPool pool(int active) {
            SqlConnectionPool pool = mock(SqlConnectionPool.class);
            when(pool.getConfig()).thenReturn(PoolConfig.builder().databasePath("p.sqlite").maxTotal(10).build());
            when(pool.getStats()).thenReturn(new PoolStats(10, active, 10 - active, 100, 100 - active, 10));
            return pool;
        }

        @Test
        @DisplayName("Low utilization should be UP")
        void lowUtilization() {
            HealthStatus status = new ConnectionPoolHealthCheck(pool(3)).check();
            assertTrue(status.isUp());
            assertEquals(10, status.details().get("maxConnections"));
        }

        @Test
        @DisplayName("High utilization should be DEGRADED")
        void highUtilization() {
            assertEquals(HealthStatus.Status.DEGRADED, new ConnectionPoolHealthCheck(pool(8)).check().status());
        }

        @Test
        @DisplayName("Exhausted pool should be DOWN")
        void exhausted() {
            assertTrue(new ConnectionPoolHealthCheck(pool(10)).check().isDown());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Empty registry should be UP")
        void emptyRegistry() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Overall status should be the worst one")
        void worstStatusWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            registry.register(fixed("c", HealthStatus.up()));

            HealthStatus overall = registry.checkAll();

            assertEquals(HealthStatus.Status.DEGRADED, overall.status());
            assertEquals("b: slow", overall.message());
            assertEquals(Set.of("a", "b", "c"), overall.details().keySet());
        }

        @Test
        @DisplayName("Memory store should get a store check only")
        void memoryStoreChecks() {
            InMemoryEntityStore memory = PeopleFixture.memoryStore();
            EntityStore store = new InstrumentedEntityStore(memory, "memory",
                    new NoOpMetricsService(), new NoOpTracingService());

            HealthCheckRegistry registry = HealthCheckRegistry.forStore(store);

            assertEquals(1, registry.size());
            assertTrue(registry.checkAll().isUp());
        }

        @Test
        @DisplayName("Relational store should add a database check")
        void relationalStoreChecks() {
            try (RelationalEntityStore store = PeopleFixture.relationalStore(tempDir)) {
                HealthCheckRegistry registry = HealthCheckRegistry.forStore(store);

                assertEquals(2, registry.size());
                HealthStatus overall = registry.checkAll();
                assertTrue(overall.isUp());
                assertEquals(Set.of("store", "database"), overall.details().keySet());
            }
        }

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }

    @Test
    @DisplayName("Type declarations should be counted by the store check")
    void typeCount() {
        EntityStore store = mock(EntityStore.class);
        when(store.types()).thenReturn(Set.of(EntityType.of("person", "Person")));
        when(store.name()).thenReturn("one");

        assertEquals(1, new StoreHealthCheck(store).check().details().get("types"));
    }
}
