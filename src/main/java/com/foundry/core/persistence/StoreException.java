package com.foundry.core.persistence;

/**
 * Raised when the underlying storage fails. Fatal to the operation in progress;
 * the store never retries or hides persistence failures.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
