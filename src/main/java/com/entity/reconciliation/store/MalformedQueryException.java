package com.entity.reconciliation.store;

/**
 * Thrown when a query carries a constraint that cannot be interpreted.
 * The whole query is rejected; no partial results are returned.
 */
public class MalformedQueryException extends StoreException {

    public MalformedQueryException(String message) {
        super(message);
    }
}
