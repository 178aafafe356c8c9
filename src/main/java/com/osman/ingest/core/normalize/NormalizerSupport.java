package com.osman.ingest.core.normalize;

import com.osman.ingest.core.coerce.TypeCoercion;
import com.osman.ingest.core.schema.CanonicalFields;
import com.osman.ingest.core.schema.ColumnRule;
import com.osman.ingest.core.table.HeaderCanonicalizer;
import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.core.table.WorkingTable;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Steps shared by the order, shipment and tracking pipelines.
 */
final class NormalizerSupport {
    static final UnaryOperator<Object> TRIMMED = TypeCoercion::toTrimmedString;
    static final UnaryOperator<Object> TRIMMED_UPPER = value -> TypeCoercion.toTrimmedString(value).toUpperCase(Locale.ROOT);
    static final UnaryOperator<Object> UTC_TIMESTAMP = TypeCoercion::toUtcTimestamp;

    private NormalizerSupport() {
    }

    static boolean isEmptyInput(RawTable raw) {
        return raw == null || raw.isEmpty() || raw.columnCount() == 0;
    }

    static WorkingTable canonicalHeaders(RawTable raw) {
        return WorkingTable.copyOf(HeaderCanonicalizer.trimAndLowercase(raw));
    }

    static void ensureRequiredColumns(WorkingTable table, List<ColumnRule> rules) {
        for (ColumnRule rule : rules) {
            if (rule.required()) {
                table.ensureColumn(rule.name());
            }
        }
    }

    static void stampTenant(WorkingTable table, String accountId, String storeId) {
        table.fill(CanonicalFields.ACCOUNT_ID, accountId);
        table.fill(CanonicalFields.STORE_ID, storeId);
    }

    static boolean hasText(WorkingTable.RowView row, String field) {
        return !row.getString(field).isEmpty();
    }

    static String text(WorkingTable table, int row, String field) {
        Object value = table.value(row, field);
        return value == null ? "" : value.toString();
    }

    static Instant timestamp(WorkingTable table, int row, String field) {
        Object value = table.value(row, field);
        return value instanceof Instant instant ? instant : null;
    }

    static int integer(WorkingTable table, int row, String field, int fallback) {
        Object value = table.value(row, field);
        return value instanceof Integer number ? number : fallback;
    }

    static Double decimal(WorkingTable table, int row, String field) {
        Object value = table.value(row, field);
        return value instanceof Double number ? number : null;
    }
}
