package com.osman.ingest.core.json;

import com.osman.ingest.core.model.CanonicalRecord;
import com.osman.ingest.core.model.CanonicalTable;
import com.osman.ingest.core.normalize.IngestionRun;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;

/**
 * Serialises an {@link IngestionRun} so the reconciliation and presentation layers can pick it up.
 * <p>
 * Each table carries its column list next to the rows because JSON objects do not keep key order.
 */
public final class CanonicalJsonWriter {
    private CanonicalJsonWriter() {
    }

    public static JSONObject toJson(IngestionRun run) {
        JSONObject root = new JSONObject();
        root.put("accountId", run.accountId());
        root.put("storeId", run.storeId());
        root.put("generatedAt", run.completedAt().toString());
        root.put("validationErrors", new JSONArray(run.validationReport().errors()));

        JSONObject tables = new JSONObject();
        tables.put(run.orders().data().name(), toJson(run.orders().data()));
        tables.put(run.shipments().data().name(), toJson(run.shipments().data()));
        tables.put(run.tracking().data().name(), toJson(run.tracking().data()));
        root.put("tables", tables);
        return root;
    }

    public static JSONObject toJson(CanonicalTable<? extends CanonicalRecord> table) {
        JSONObject tableObj = new JSONObject();
        tableObj.put("columns", new JSONArray(table.columns()));
        JSONArray rows = new JSONArray();
        for (Map<String, Object> row : table.toRows()) {
            JSONObject rowObj = new JSONObject();
            row.forEach((column, value) -> rowObj.put(column, toJsonValue(value)));
            rows.put(rowObj);
        }
        tableObj.put("rows", rows);
        return tableObj;
    }

    public static void write(IngestionRun run, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            toJson(run).toString(2),
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    private static Object toJsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        return value;
    }
}
