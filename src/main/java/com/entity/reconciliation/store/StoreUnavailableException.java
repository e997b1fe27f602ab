package com.entity.reconciliation.store;

/**
 * Thrown when the storage behind a store cannot be reached or fails mid-query.
 * Queries are not retried.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
