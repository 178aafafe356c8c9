package com.osman.ingest.core.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Mutable column-addressable copy of a {@link RawTable} that the pipelines reshape step by step.
 * <p>
 * When several columns share a name (for example two source headers aliased to the same field) the rightmost one
 * is the one read and written. The others stay in place untouched.
 */
public final class WorkingTable {
    private final List<String> headers;
    private final List<List<Object>> rows;

    private WorkingTable(List<String> headers, List<List<Object>> rows) {
        this.headers = headers;
        this.rows = rows;
    }

    public static WorkingTable copyOf(RawTable source) {
        List<List<Object>> rows = new ArrayList<>(source.rowCount());
        for (List<Object> row : source.rows()) {
            rows.add(new ArrayList<>(row));
        }
        return new WorkingTable(new ArrayList<>(source.headers()), rows);
    }

    public List<String> headers() {
        return Collections.unmodifiableList(headers);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String name) {
        return headers.contains(name);
    }

    /**
     * Rename every header that has an entry in {@code aliases}.
     *
     * @return number of headers renamed
     */
    public int renameColumns(Map<String, String> aliases) {
        int renamed = 0;
        for (int i = 0; i < headers.size(); i++) {
            String target = aliases.get(headers.get(i));
            if (target != null) {
                headers.set(i, target);
                renamed++;
            }
        }
        return renamed;
    }

    /**
     * Append an all-null column unless one with this name already exists.
     *
     * @return {@code true} when a column was added
     */
    public boolean ensureColumn(String name) {
        if (hasColumn(name)) {
            return false;
        }
        headers.add(name);
        for (List<Object> row : rows) {
            row.add(null);
        }
        return true;
    }

    /**
     * Set every row of the column to the same value, adding the column if needed.
     */
    public void fill(String name, Object value) {
        int index = indexOrAppend(name);
        for (List<Object> row : rows) {
            row.set(index, value);
        }
    }

    /**
     * Replace each value of the column with {@code operator(value)}. A missing column is treated as all-null.
     */
    public void transform(String name, UnaryOperator<Object> operator) {
        int index = indexOrAppend(name);
        for (List<Object> row : rows) {
            row.set(index, operator.apply(row.get(index)));
        }
    }

    public Object value(int row, String name) {
        int index = headers.lastIndexOf(name);
        return index < 0 ? null : rows.get(row).get(index);
    }

    /**
     * Drop rows for which {@code keep} is false.
     *
     * @return number of rows removed
     */
    public int retainRows(Predicate<RowView> keep) {
        int before = rows.size();
        List<List<Object>> kept = new ArrayList<>(before);
        for (List<Object> row : rows) {
            if (keep.test(new RowView(row))) {
                kept.add(row);
            }
        }
        rows.clear();
        rows.addAll(kept);
        return before - kept.size();
    }

    private int indexOrAppend(String name) {
        ensureColumn(name);
        return headers.lastIndexOf(name);
    }

    /**
     * Read-only view of one row, resolved by column name.
     */
    public final class RowView {
        private final List<Object> cells;

        private RowView(List<Object> cells) {
            this.cells = cells;
        }

        public Object get(String name) {
            int index = headers.lastIndexOf(name);
            return index < 0 ? null : cells.get(index);
        }

        public String getString(String name) {
            Object value = get(name);
            return value == null ? "" : value.toString();
        }
    }
}
