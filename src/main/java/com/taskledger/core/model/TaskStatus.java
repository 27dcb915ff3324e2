package com.taskledger.core.model;

import java.util.Locale;

/**
 * Lifecycle status shared by planned tasks and their recorded test attempts.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /** Lower-case form stored in the database. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status must not be null");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
