package com.taskledger.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Status of a plan as a whole.
 * <p>
 * Allowed transitions: {@code PLANNING -> RUNNING -> {COMPLETED, FAILED}},
 * and {@code RUNNING <-> PAUSED}. Terminal states accept no transitions.
 */
public enum PlanStatus {
    PLANNING,
    RUNNING,
    COMPLETED,
    FAILED,
    PAUSED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(PlanStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<PlanStatus> allowedTargets() {
        return switch (this) {
            case PLANNING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, PAUSED);
            case PAUSED -> EnumSet.of(RUNNING);
            case COMPLETED, FAILED -> EnumSet.noneOf(PlanStatus.class);
        };
    }

    public static PlanStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Plan status must not be null");
        }
        return PlanStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
