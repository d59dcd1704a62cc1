package com.verso.registry.repository;

/**
 * A failure of the backing store other than a missing record.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
