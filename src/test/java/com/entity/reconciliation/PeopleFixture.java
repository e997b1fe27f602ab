package com.entity.reconciliation;

import com.entity.reconciliation.cache.CacheConfig;
import com.entity.reconciliation.loader.FlatFile;
import com.entity.reconciliation.loader.FlatFileReader;
import com.entity.reconciliation.memory.InMemoryEntityStore;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.sql.RelationalStoreWriter;
import com.entity.reconciliation.sql.SqliteConnection;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Shared test data: a small catalog of people, places and works, loaded from
 * {@code fixtures/people.tsv} into either backend.
 */
public final class PeopleFixture {

    public static final String RESOURCE = "/fixtures/people.tsv";
    public static final int ENTITY_COUNT = 11;

    private PeopleFixture() {
    }

    public static FlatFile read() {
        try (InputStream in = PeopleFixture.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + RESOURCE);
            }
            return new FlatFileReader().read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static InMemoryEntityStore memoryStore() {
        FlatFile file = read();
        return new InMemoryEntityStore(file.metadata(), file.records().iterator());
    }

    /**
     * Writes the fixture into a new SQLite database under the given directory.
     */
    public static Path writeDatabase(Path dir) {
        Path db = dir.resolve("people.sqlite");
        FlatFile file = read();
        try (SqliteConnection connection = new SqliteConnection(db.toString(), false)) {
            new RelationalStoreWriter(connection).write(file.metadata(), file.records().iterator());
        }
        return db;
    }

    public static RelationalEntityStore relationalStore(Path dir) {
        Path db = writeDatabase(dir);
        return RelationalEntityStore.builder()
                .connection(new SqliteConnection(db.toString(), true))
                .cacheConfig(CacheConfig.defaults())
                .build();
    }
}
