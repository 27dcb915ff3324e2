package com.taskledger.core.persistence;

/**
 * The store was unreachable, overloaded or aborted the statement. The outcome of the
 * operation is unknown; callers decide whether to retry.
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
