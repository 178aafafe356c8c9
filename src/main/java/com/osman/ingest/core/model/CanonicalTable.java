package com.osman.ingest.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-schema output of a normalization pipeline: the column list of its kind plus the records.
 * The column list is exposed even when there are no records.
 */
public final class CanonicalTable<T extends CanonicalRecord> {
    private final String name;
    private final List<String> columns;
    private final List<T> records;

    public CanonicalTable(String name, List<String> columns, List<T> records) {
        this.name = Objects.requireNonNull(name, "name");
        this.columns = List.copyOf(columns);
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static <T extends CanonicalRecord> CanonicalTable<T> empty(String name, List<String> columns) {
        return new CanonicalTable<>(name, columns, List.of());
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<T> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Records rendered as column-ordered maps, the shape downstream reconciliation consumes.
     */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (T record : records) {
            rows.add(record.toRow());
        }
        return rows;
    }

    @Override
    public String toString() {
        return "CanonicalTable{" + name + ", rows=" + records.size() + '}';
    }
}
