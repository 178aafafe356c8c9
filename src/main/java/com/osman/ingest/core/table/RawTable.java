package com.osman.ingest.core.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a caller-supplied spreadsheet export.
 * <p>
 * Headers are kept exactly as supplied: they may repeat, carry whitespace or any casing. Cells are addressed by
 * column position so repeated headers never hide each other. Rows shorter than the header list read as {@code null}
 * in the missing positions.
 */
public final class RawTable {
    private static final RawTable EMPTY = new RawTable(List.of(), List.of());

    private final List<String> headers;
    private final List<List<Object>> rows;

    private RawTable(List<String> headers, List<List<Object>> rows) {
        this.headers = headers;
        this.rows = rows;
    }

    public static RawTable empty() {
        return EMPTY;
    }

    /**
     * Build a table from positional rows.
     */
    public static RawTable of(List<String> headers, List<? extends List<?>> rows) {
        Objects.requireNonNull(headers, "headers");
        List<String> headerCopy = new ArrayList<>(headers.size());
        for (String header : headers) {
            headerCopy.add(header == null ? "" : header);
        }
        List<List<Object>> rowCopy = new ArrayList<>();
        if (rows != null) {
            for (List<?> row : rows) {
                List<Object> cells = new ArrayList<>(headerCopy.size());
                for (int i = 0; i < headerCopy.size(); i++) {
                    cells.add(row != null && i < row.size() ? row.get(i) : null);
                }
                rowCopy.add(Collections.unmodifiableList(cells));
            }
        }
        return new RawTable(Collections.unmodifiableList(headerCopy), Collections.unmodifiableList(rowCopy));
    }

    /**
     * Build a table from header-keyed rows. The header order is the first-seen order across all rows.
     */
    public static RawTable fromRecords(List<? extends Map<String, ?>> records) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }
        Set<String> headerSet = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            if (record != null) {
                headerSet.addAll(record.keySet());
            }
        }
        List<String> headers = new ArrayList<>(headerSet);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> cells = new ArrayList<>(headers.size());
            for (String header : headers) {
                cells.add(record == null ? null : record.get(header));
            }
            rows.add(cells);
        }
        return of(headers, rows);
    }

    public List<String> headers() {
        return headers;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return headers.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object cell(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * Copy with the given headers, keeping every cell in place.
     */
    public RawTable withHeaders(List<String> replacement) {
        if (replacement.size() != headers.size()) {
            throw new IllegalArgumentException(
                "Expected %d headers but got %d".formatted(headers.size(), replacement.size()));
        }
        return of(replacement, rows);
    }

    @Override
    public String toString() {
        return "RawTable{headers=" + headers + ", rows=" + rows.size() + '}';
    }
}
