package com.taskledger.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.regex.Pattern;

/**
 * Outcome of one tool call.
 *
 * @param success      whether the call succeeded
 * @param output       raw tool output (nullable)
 * @param errorMessage failure description (nullable)
 */
public record ToolExecutionResult(boolean success, JsonNode output, String errorMessage) {

    private static final Pattern ERROR_TEXT = Pattern.compile("error|failed|exception|traceback",
            Pattern.CASE_INSENSITIVE);

    public static ToolExecutionResult success(JsonNode output) {
        return new ToolExecutionResult(true, output, null);
    }

    public static ToolExecutionResult failure(String errorMessage) {
        return new ToolExecutionResult(false, JsonNodeFactory.instance.nullNode(), errorMessage);
    }

    /**
     * Classifies raw output. A boolean {@code success} field decides when present;
     * otherwise output whose text mentions an error, failure, exception or traceback is a failure.
     */
    public static ToolExecutionResult inferFrom(JsonNode output) {
        if (looksFailed(output)) {
            return new ToolExecutionResult(false, output, describe(output));
        }
        return success(output);
    }

    static boolean looksFailed(JsonNode output) {
        if (output == null || output.isNull()) {
            return false;
        }
        JsonNode flag = output.get("success");
        if (flag != null && flag.isBoolean()) {
            return !flag.booleanValue();
        }
        String text = output.isTextual() ? output.textValue() : output.toString();
        return ERROR_TEXT.matcher(text).find();
    }

    private static String describe(JsonNode output) {
        JsonNode error = output.get("error");
        if (error != null && !error.isNull()) {
            return error.isTextual() ? error.textValue() : error.toString();
        }
        String text = output.isTextual() ? output.textValue() : output.toString();
        return text.length() > 500 ? text.substring(0, 500) : text;
    }
}
