package com.osman.ingest.core.json;

import com.osman.ingest.config.IngestSettings;
import com.osman.ingest.core.model.OrderLine;
import com.osman.ingest.core.normalize.IngestionRun;
import com.osman.ingest.core.normalize.IngestionService;
import com.osman.ingest.core.table.RawTable;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanonicalJsonWriterTest {

    @TempDir
    Path tempDir;

    private static IngestionRun sampleRun() {
        RawTable orders = RawTable.of(List.of("order_id", "sku", "order_datetime_utc"),
            List.of(List.of("#1", "a", "2024-03-01T12:00:00Z")));
        return new IngestionService().run(orders, RawTable.empty(), null,
            new IngestSettings("acct", "store", "woocommerce", "USD", 3, false));
    }

    @Test
    void rendersTablesWithColumnsAndRows() {
        JSONObject json = CanonicalJsonWriter.toJson(sampleRun());

        assertEquals("acct", json.getString("accountId"));
        assertEquals("store", json.getString("storeId"));

        JSONArray errors = json.getJSONArray("validationErrors");
        assertEquals(1, errors.length());
        assertEquals("[shipments] Input shipments dataframe is empty.", errors.getString(0));

        JSONObject orders = json.getJSONObject("tables").getJSONObject("orders");
        assertEquals(OrderLine.COLUMNS.size(), orders.getJSONArray("columns").length());
        assertEquals("account_id", orders.getJSONArray("columns").getString(0));

        JSONObject row = orders.getJSONArray("rows").getJSONObject(0);
        assertEquals("#1", row.getString("order_id"));
        assertEquals("A", row.getString("sku"));
        assertEquals("2024-03-01T12:00:00Z", row.getString("order_datetime_utc"));
        assertEquals(1, row.getInt("quantity_ordered"));
        assertTrue(row.isNull("order_revenue"));

        JSONObject tracking = json.getJSONObject("tables").getJSONObject("tracking");
        assertEquals(0, tracking.getJSONArray("rows").length());
        assertEquals(11, tracking.getJSONArray("columns").length());
    }

    @Test
    void writesIndentedFileCreatingParents() throws IOException {
        Path target = tempDir.resolve("out/nested/run.json");

        CanonicalJsonWriter.write(sampleRun(), target);
        CanonicalJsonWriter.write(sampleRun(), target);

        assertTrue(Files.exists(target), "Run file should be written");
        JSONObject reloaded = new JSONObject(Files.readString(target));
        assertEquals(1, reloaded.getJSONObject("tables").getJSONObject("orders").getJSONArray("rows").length());
        assertTrue(Files.readString(target).contains("\n  \""));
    }
}
