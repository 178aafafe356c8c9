package com.osman.ingest.core.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkingTableTest {

    @Test
    void canonicalizerTrimsAndLowercasesCopy() {
        RawTable raw = RawTable.of(List.of("  Order ID ", "SKU"), List.of(List.of("1", "a")));

        RawTable trimmed = HeaderCanonicalizer.trim(raw);
        RawTable lowered = HeaderCanonicalizer.trimAndLowercase(raw);

        assertEquals(List.of("Order ID", "SKU"), trimmed.headers());
        assertEquals(List.of("order id", "sku"), lowered.headers());
        assertEquals(lowered.headers(), HeaderCanonicalizer.trimAndLowercase(lowered).headers());
        assertEquals(List.of("  Order ID ", "SKU"), raw.headers());
        assertEquals("1", lowered.cell(0, 0));
    }

    @Test
    void padsRaggedRowsAndNullHeaders() {
        RawTable raw = RawTable.of(Arrays.asList("a", null, "c"), List.of(List.of("1")));

        assertEquals(List.of("a", "", "c"), raw.headers());
        assertEquals(3, raw.columnCount());
        assertEquals("1", raw.cell(0, 0));
        assertNull(raw.cell(0, 2));
    }

    @Test
    void buildsFromRecordsInFirstSeenHeaderOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("c", 3);

        RawTable raw = RawTable.fromRecords(List.of(first, second));

        assertEquals(List.of("b", "a", "c"), raw.headers());
        assertEquals(2, raw.rowCount());
        assertNull(raw.cell(1, 0));
        assertEquals(3, raw.cell(1, 2));
    }

    @Test
    void renamesAliasesAndReadsRightmostDuplicate() {
        RawTable raw = RawTable.of(List.of("lineitem sku", "variant sku", "qty"),
            List.of(List.of("A-1", "B-2", "3")));
        WorkingTable table = WorkingTable.copyOf(raw);

        int renamed = table.renameColumns(Map.of("lineitem sku", "sku", "variant sku", "sku"));

        assertEquals(2, renamed);
        assertEquals(List.of("sku", "sku", "qty"), table.headers());
        assertEquals("B-2", table.value(0, "sku"));
        assertEquals(List.of("lineitem sku", "variant sku", "qty"), raw.headers());
    }

    @Test
    void ensuresMissingColumnsAsNull() {
        WorkingTable table = WorkingTable.copyOf(RawTable.of(List.of("a"), List.of(List.of("1"), List.of("2"))));

        assertTrue(table.ensureColumn("b"));
        assertFalse(table.ensureColumn("a"));
        assertNull(table.value(1, "b"));
        assertNull(table.value(0, "missing"));
    }

    @Test
    void transformsAndFiltersRows() {
        WorkingTable table = WorkingTable.copyOf(RawTable.of(List.of("id"),
            List.of(List.of(" x "), Arrays.asList((Object) null), List.of("y"))));

        table.transform("id", value -> value == null ? "" : value.toString().trim());
        table.fill("tenant", "acct");
        int dropped = table.retainRows(row -> !row.getString("id").isEmpty());

        assertEquals(1, dropped);
        assertEquals(2, table.rowCount());
        assertEquals("x", table.value(0, "id"));
        assertEquals("acct", table.value(1, "tenant"));
    }
}
