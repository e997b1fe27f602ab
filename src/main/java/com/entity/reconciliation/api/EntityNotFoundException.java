package com.entity.reconciliation.api;

/**
 * Thrown when a request names an entity the store does not hold.
 */
public class EntityNotFoundException extends RuntimeException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
