package com.taskledger.core.persistence;

/**
 * A write was rejected because it violates a uniqueness, format or enum constraint.
 */
public class ConstraintViolationException extends StoreException {

    private final String key;

    public ConstraintViolationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ConstraintViolationException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** The offending key (task id, test id, plan id), or {@code null} if unknown. */
    public String key() {
        return key;
    }
}
