package com.entity.reconciliation.store.record;

/**
 * One unit of input consumed when a store is built: a type, a property definition
 * or an entity.
 */
public sealed interface StoreRecord permits TypeRecord, PropertyRecord, EntityRecord {
}
