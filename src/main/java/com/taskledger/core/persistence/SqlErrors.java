package com.taskledger.core.persistence;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps JDBC failures onto the store exception hierarchy using SQLSTATE codes.
 */
public final class SqlErrors {

    private static final Set<String> TRANSIENT_STATES = Set.of("40001", "40P01", "57014");

    private SqlErrors() {}

    public static StoreException translate(String operation, SQLException e) {
        return translate(operation, null, e);
    }

    public static StoreException translate(String operation, String key, SQLException e) {
        String state = e.getSQLState();
        String message = operation + " failed: " + e.getMessage();
        if (e instanceof SQLTransientException || isTransientState(state)) {
            return new TransientStoreException(message, e);
        }
        if (e instanceof SQLIntegrityConstraintViolationException
                || (state != null && state.startsWith("23"))) {
            return new ConstraintViolationException(key, message, e);
        }
        return new StoreException(message, e);
    }

    private static boolean isTransientState(String state) {
        if (state == null) {
            return false;
        }
        return state.startsWith("08") || state.startsWith("53") || TRANSIENT_STATES.contains(state);
    }
}
