package com.osman.ingest.core.schema;

import java.util.Objects;

/**
 * Presence rule for one canonical field.
 */
public record ColumnRule(String name, boolean required) {

    public ColumnRule {
        Objects.requireNonNull(name, "name");
    }

    public static ColumnRule required(String name) {
        return new ColumnRule(name, true);
    }

    public static ColumnRule optional(String name) {
        return new ColumnRule(name, false);
    }
}
