package com.osman.ingest.core.model;

import java.util.Objects;

/**
 * What one pipeline invocation produces: the canonical table and its validation report.
 */
public record NormalizationResult<T extends CanonicalRecord>(CanonicalTable<T> data, ValidationReport errors) {

    public NormalizationResult {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(errors, "errors");
    }
}
