package com.entity.reconciliation.store.record;

import com.entity.reconciliation.core.model.Property;

import java.util.List;
import java.util.Objects;

/**
 * Declares a property and the types it applies to.
 *
 * @param property the property definition
 * @param typeIds  ids of the types carrying the property, at least one
 */
public record PropertyRecord(Property property, List<String> typeIds) implements StoreRecord {
    public PropertyRecord {
        Objects.requireNonNull(property, "property is required");
        typeIds = List.copyOf(typeIds);
        if (typeIds.isEmpty()) {
            throw new IllegalArgumentException("Property " + property.id() + " must apply to at least one type");
        }
    }
}
