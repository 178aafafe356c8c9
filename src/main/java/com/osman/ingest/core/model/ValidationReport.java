package com.osman.ingest.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, advisory data-quality messages. Each message is prefixed with its table, e.g.
 * {@code [orders] Missing required column: sku}. Whether any of them is fatal is up to the caller.
 */
public record ValidationReport(List<String> errors) {
    private static final ValidationReport EMPTY = new ValidationReport(List.of());

    public ValidationReport {
        errors = List.copyOf(errors);
    }

    public static ValidationReport empty() {
        return EMPTY;
    }

    public static ValidationReport of(String... errors) {
        return new ValidationReport(List.of(errors));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public ValidationReport plus(ValidationReport other) {
        if (other.isEmpty()) {
            return this;
        }
        List<String> combined = new ArrayList<>(errors);
        combined.addAll(other.errors);
        return new ValidationReport(combined);
    }
}
