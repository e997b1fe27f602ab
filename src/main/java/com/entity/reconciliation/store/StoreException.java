package com.entity.reconciliation.store;

/**
 * Base class of the failures an {@link EntityStore} reports to its callers.
 * Not-found and empty results are not failures and are never reported this way.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
