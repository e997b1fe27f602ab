package com.entity.reconciliation.store.record;

import com.entity.reconciliation.core.model.EntityId;
import com.entity.reconciliation.core.model.PropertyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one entity as loaded, before types are resolved against the catalog.
 *
 * @param rawKey      record key, unique per type list
 * @param name        entity name
 * @param description entity description, may be blank
 * @param typeIds     declared type ids, primary type first
 * @param properties  property values keyed by property id
 */
public record EntityRecord(
        String rawKey,
        String name,
        String description,
        List<String> typeIds,
        Map<String, PropertyValue> properties
) implements StoreRecord {
    public EntityRecord {
        Objects.requireNonNull(rawKey, "rawKey is required");
        name = name != null ? name : "";
        description = description != null ? description : "";
        typeIds = List.copyOf(typeIds);
        if (typeIds.isEmpty()) {
            throw new IllegalArgumentException("Entity " + rawKey + " must declare at least one type");
        }
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
    }

    /**
     * Returns the primary type id, the first one declared.
     */
    public String primaryTypeId() {
        return typeIds.get(0);
    }

    /**
     * Returns the externally visible id, {@code primaryType:rawKey}.
     */
    public String compositeId() {
        return EntityId.compose(primaryTypeId(), rawKey);
    }
}
