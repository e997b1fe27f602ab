package com.entity.reconciliation.benchmark;

import com.entity.reconciliation.cache.CacheConfig;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.memory.InMemoryEntityStore;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.sql.RelationalStoreWriter;
import com.entity.reconciliation.sql.SqliteConnection;
import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.EntityRecord;
import com.entity.reconciliation.store.record.StoreRecord;
import com.entity.reconciliation.store.record.TypeRecord;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * JMH benchmarks comparing the linear-scan in-memory store with the full-text
 * relational store on exact, text and prefix lookups.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class StoreQueryBenchmark {

    private static final String[] WORDS = {
            "North", "River", "Bridge", "Stone", "Harbor", "Valley", "Summit", "Forest", "Lake", "Field"
    };

    @Param({"1000", "10000"})
    private int entityCount;

    private Path directory;
    private InMemoryEntityStore memoryStore;
    private RelationalEntityStore relationalStore;
    private int queryCounter;

    @Setup(Level.Trial)
    public void setUp() throws IOException {
        StoreMetadata metadata = new StoreMetadata("Benchmark", "", "", "", "place");
        List<StoreRecord> records = new ArrayList<>(entityCount + 1);
        records.add(new TypeRecord(EntityType.of("place", "Place")));
        for (int i = 0; i < entityCount; i++) {
            String name = WORDS[i % WORDS.length] + " " + WORDS[(i / WORDS.length) % WORDS.length] + " " + i;
            records.add(new EntityRecord("p" + i, name, "", List.of("place"),
                    Map.of("rank", PropertyValue.of((long) i))));
        }

        memoryStore = new InMemoryEntityStore(metadata, records.iterator());

        directory = Files.createTempDirectory("reconciliation-bench");
        String db = directory.resolve("bench.sqlite").toString();
        try (SqliteConnection connection = new SqliteConnection(db, false)) {
            new RelationalStoreWriter(connection).write(metadata, records.iterator());
        }
        relationalStore = RelationalEntityStore.builder()
                .connection(new SqliteConnection(db, true))
                .cacheConfig(CacheConfig.disabled())
                .build();
        queryCounter = 0;
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        relationalStore.close();
        memoryStore.close();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
        }
        Files.deleteIfExists(directory);
    }

    @Benchmark
    public void memoryExactKey(Blackhole bh) {
        bh.consume(memoryStore.query(QueryRequest.of("p" + nextIndex())));
    }

    @Benchmark
    public void relationalExactKey(Blackhole bh) {
        bh.consume(relationalStore.query(QueryRequest.of("p" + nextIndex())));
    }

    /**
     * Text query: the in-memory store scores every entity, the relational store
     * ranks full-text hits only.
     */
    @Benchmark
    public void memoryTextQuery(Blackhole bh) {
        bh.consume(memoryStore.query(QueryRequest.of(textQuery())));
    }

    @Benchmark
    public void relationalTextQuery(Blackhole bh) {
        bh.consume(relationalStore.query(QueryRequest.of(textQuery())));
    }

    @Benchmark
    public void memoryPrefix(Blackhole bh) {
        bh.consume(memoryStore.queryPrefix(WORDS[nextIndex() % WORDS.length].substring(0, 3), 25));
    }

    @Benchmark
    public void relationalPrefix(Blackhole bh) {
        bh.consume(relationalStore.queryPrefix(WORDS[nextIndex() % WORDS.length].substring(0, 3), 25));
    }

    private int nextIndex() {
        return queryCounter++ % entityCount;
    }

    private String textQuery() {
        int idx = nextIndex();
        return WORDS[idx % WORDS.length] + " " + WORDS[(idx / WORDS.length) % WORDS.length];
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(StoreQueryBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
