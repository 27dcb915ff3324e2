package com.taskledger.core.model;

import java.util.Locale;

public enum TaskComplexity {
    LOW,
    MEDIUM,
    HIGH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskComplexity fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task complexity must not be null");
        }
        return TaskComplexity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
