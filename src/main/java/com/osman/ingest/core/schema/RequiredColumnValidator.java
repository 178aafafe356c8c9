package com.osman.ingest.core.schema;

import com.osman.ingest.core.table.WorkingTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports required fields that are absent from a table's columns.
 * <p>
 * The pipelines call this after they have already added every required field as a null column, so with the
 * shipped rule lists it only fires when a required field escaped that synthesis step. Callers running it on a
 * freshly aliased table get the stricter pre-synthesis behaviour.
 */
public final class RequiredColumnValidator {
    private RequiredColumnValidator() {
    }

    public static List<String> validate(WorkingTable table, List<ColumnRule> rules, String tableName) {
        return validate(table.headers(), rules, tableName);
    }

    public static List<String> validate(List<String> columns, List<ColumnRule> rules, String tableName) {
        Set<String> present = new HashSet<>(columns);
        List<String> errors = new ArrayList<>();
        for (ColumnRule rule : rules) {
            if (rule.required() && !present.contains(rule.name())) {
                errors.add("[%s] Missing required column: %s".formatted(tableName, rule.name()));
            }
        }
        return errors;
    }
}
