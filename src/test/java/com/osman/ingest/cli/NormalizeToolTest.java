package com.osman.ingest.cli;

import com.osman.ingest.config.IngestSettings;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NormalizeToolTest {

    @TempDir
    Path tempDir;

    private final IngestSettings settings = new IngestSettings("acct", "store", "shopify", "USD", 3, false);

    @AfterEach
    void clearDataDirProperty() {
        System.clearProperty(NormalizeTool.DATA_DIR_PROPERTY);
    }

    @Test
    void missingDataDirIsUsageError() {
        assertEquals(NormalizeTool.EXIT_USAGE, NormalizeTool.run(new String[0], settings));
        assertEquals(NormalizeTool.EXIT_USAGE,
            NormalizeTool.run(new String[]{tempDir.resolve("nope").toString()}, settings));
    }

    @Test
    void writesCanonicalRunNextToExports() throws Exception {
        Files.writeString(tempDir.resolve("orders.csv"),
            "Name,Created at,Lineitem SKU,Lineitem quantity,Shipping Country\n"
                + "#1001,2024-01-05T10:00:00Z,abc-1,2,US\n");
        Files.writeString(tempDir.resolve("shipments.csv"),
            "Supplier,PO,Order ID,SKU,Qty,Ship Date\n"
                + "Acme,PO-1,#1001,abc-1,2,2024-01-06\n");

        int code = NormalizeTool.run(new String[]{tempDir.toString()}, settings);

        assertEquals(NormalizeTool.EXIT_OK, code);
        Path output = tempDir.resolve(NormalizeTool.DEFAULT_OUTPUT);
        assertTrue(Files.exists(output), "Canonical run should be written");

        JSONObject json = new JSONObject(Files.readString(output));
        JSONObject tables = json.getJSONObject("tables");
        assertEquals(1, tables.getJSONObject("orders").getJSONArray("rows").length());
        assertEquals(1, tables.getJSONObject("shipments").getJSONArray("rows").length());
        assertEquals(0, tables.getJSONObject("tracking").getJSONArray("rows").length());
        assertEquals(0, json.getJSONArray("validationErrors").length());
    }

    @Test
    void dataDirAndOutputCanComeFromPropertyAndSecondArgument() throws Exception {
        Files.writeString(tempDir.resolve("tracking.tsv"), "Carrier\tTracking Number\nUPS\t1Z1\n");
        System.setProperty(NormalizeTool.DATA_DIR_PROPERTY, tempDir.toString());
        Path output = tempDir.resolve("reports/run.json");

        int code = NormalizeTool.run(new String[]{"", output.toString()}, settings);

        assertEquals(NormalizeTool.EXIT_OK, code);
        JSONObject json = new JSONObject(Files.readString(output));
        assertEquals(2, json.getJSONArray("validationErrors").length());
        assertEquals("UPS", json.getJSONObject("tables").getJSONObject("tracking")
            .getJSONArray("rows").getJSONObject(0).getString("carrier"));
    }
}
