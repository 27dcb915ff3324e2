package com.taskledger.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered path of segments that scopes keys in the shared key-value store.
 * A key is only unique within its namespace.
 *
 * @param segments non-empty, non-blank path segments
 */
public record Namespace(List<String> segments) {

    public Namespace {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Namespace must have at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Namespace segments must not be blank: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    public static Namespace of(String... segments) {
        return new Namespace(List.of(segments));
    }

    /**
     * Returns a new namespace with {@code segment} appended.
     */
    public Namespace child(String segment) {
        var extended = new ArrayList<>(segments);
        extended.add(segment);
        return new Namespace(extended);
    }

    public String[] toArray() {
        return segments.toArray(String[]::new);
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
