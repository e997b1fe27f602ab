package com.entity.reconciliation.sql;

import com.entity.reconciliation.core.model.EntityId;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.EntityRecord;
import com.entity.reconciliation.store.record.PropertyRecord;
import com.entity.reconciliation.store.record.StoreRecord;
import com.entity.reconciliation.store.record.TypeList;
import com.entity.reconciliation.store.record.TypeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Creates the relational schema in an empty SQLite database and fills it from store records,
 * in a single transaction that ends with a rebuild of the full-text index.
 *
 * <p>The resulting database answers queries exactly like an in-memory store loaded from the
 * same records: a later entity with the same composite id replaces an earlier one, and
 * entity reference values are stored by raw key.</p>
 */
public class RelationalStoreWriter {
    private static final Logger log = LoggerFactory.getLogger(RelationalStoreWriter.class);

    private final SqlConnection connection;

    public RelationalStoreWriter(SqlConnection connection) {
        this.connection = connection;
    }

    /**
     * Writes a complete store.
     *
     * @return the number of entities written
     * @throws com.entity.reconciliation.store.StoreUnavailableException if a statement fails;
     *                                                                   nothing is written then
     */
    public int write(StoreMetadata metadata, Iterator<? extends StoreRecord> records) {
        int count = connection.inTransaction(tx -> {
            SqlQueryExecutor executor = new SqlQueryExecutor(tx);
            executor.createSchema();
            executor.insertMetadata("name", metadata.name());
            executor.insertMetadata("identifierNamespace", metadata.identifierNamespace());
            executor.insertMetadata("schemaNamespace", metadata.schemaNamespace());
            executor.insertMetadata("view_url", metadata.viewUrlTemplate());
            executor.insertMetadata(RelationalEntityStore.DEFAULT_TYPE_KEY, metadata.defaultTypeId());

            // composite id -> stored type list
            Map<String, String> written = new HashMap<>();
            while (records.hasNext()) {
                StoreRecord record = records.next();
                if (record instanceof TypeRecord tr) {
                    writeType(executor, tr.type());
                } else if (record instanceof PropertyRecord pr) {
                    writeProperty(executor, pr);
                } else if (record instanceof EntityRecord er) {
                    writeEntity(executor, er, written);
                }
            }
            executor.rebuildFullTextIndex();
            return written.size();
        });
        log.info("store.written database={} entities={}", connection.getDatabaseName(), count);
        return count;
    }

    /**
     * Returns the text stored for a property value. References are stored by raw key so that
     * query constraints, which compare raw keys, find them.
     */
    static String storedValue(PropertyValue value) {
        return value.asReference()
                .map(ref -> EntityId.rawKey(ref.id()))
                .orElseGet(value::asString);
    }

    private void writeType(SqlQueryExecutor executor, EntityType type) {
        executor.upsertType(type.id(), type.name(), type.description(), type.viewUrlTemplate());
    }

    private void writeProperty(SqlQueryExecutor executor, PropertyRecord record) {
        Property property = record.property();
        executor.upsertProperty(property.id(), property.name(), property.description(), property.valueType());
        for (String typeId : record.typeIds()) {
            executor.linkPropertyToType(property.id(), typeId);
        }
    }

    private void writeEntity(SqlQueryExecutor executor, EntityRecord record, Map<String, String> written) {
        String typeList = TypeList.join(record.typeIds());
        String previous = written.put(record.compositeId(), typeList);
        if (previous != null) {
            log.warn("store.duplicate id={} keeping last definition", record.compositeId());
            executor.deleteEntity(previous, record.rawKey());
        }
        executor.insertEntity(typeList, record.rawKey(), record.name(), record.description());
        for (Map.Entry<String, PropertyValue> entry : record.properties().entrySet()) {
            executor.insertEntityProperty(typeList, record.rawKey(), entry.getKey(), storedValue(entry.getValue()));
        }
    }
}
