package com.osman.ingest.core.model;

import java.util.Map;

/**
 * A row of one of the canonical tables.
 */
public interface CanonicalRecord {

    /**
     * Field values keyed by canonical column name, in canonical column order.
     */
    Map<String, Object> toRow();
}
