package com.entity.reconciliation.store.record;

import com.entity.reconciliation.core.model.EntityType;

import java.util.Objects;

/**
 * Declares a type.
 */
public record TypeRecord(EntityType type) implements StoreRecord {
    public TypeRecord {
        Objects.requireNonNull(type, "type is required");
    }
}
