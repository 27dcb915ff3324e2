package com.taskledger.core.persistence;

/**
 * Base failure of any durable or in-memory store operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
