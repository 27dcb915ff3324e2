package com.taskledger.core.persistence;

import java.util.regex.Pattern;

/**
 * Validation and sanitising of task identifiers.
 */
public final class TaskIds {

    public static final int MAX_LENGTH = 64;

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_.:-]{1," + MAX_LENGTH + "}$");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_.:-]");

    private TaskIds() {}

    public static boolean isValid(String taskId) {
        return taskId != null && VALID.matcher(taskId).matches();
    }

    /**
     * @throws ConstraintViolationException if the id does not match the task id format
     */
    public static String requireValid(String taskId) {
        if (!isValid(taskId)) {
            throw new ConstraintViolationException(taskId, "Invalid task id: '" + taskId + "'");
        }
        return taskId;
    }

    /**
     * Replaces every character outside the task id alphabet with {@code _}.
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "_";
        }
        return UNSAFE_CHARS.matcher(raw).replaceAll("_");
    }
}
