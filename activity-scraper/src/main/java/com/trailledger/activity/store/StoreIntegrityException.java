package com.trailledger.activity.store;

/**
 * A natural-key uniqueness violation, or a write against a row that does not exist.
 */
public class StoreIntegrityException extends RuntimeException {

    public StoreIntegrityException(String message) {
        super(message);
    }

    public StoreIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
