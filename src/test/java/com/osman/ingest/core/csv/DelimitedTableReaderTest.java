package com.osman.ingest.core.csv;

import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.OrderLine;
import com.osman.ingest.core.model.ShipmentLine;
import com.osman.ingest.core.normalize.OrdersNormalizer;
import com.osman.ingest.core.normalize.ShipmentsNormalizer;
import com.osman.ingest.core.table.RawTable;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DelimitedTableReaderTest {

    @Test
    void readsQuotedCellsAndKeepsDuplicateHeaders() throws IOException {
        String csv = "sku,sku,total\n"
            + "a,b,\"1,250.00\"\n";

        RawTable table = DelimitedTableReader.csv().read(new StringReader(csv), "inline.csv");

        assertEquals(List.of("sku", "sku", "total"), table.headers());
        assertEquals(1, table.rowCount());
        assertEquals("b", table.cell(0, 1));
        assertEquals("1,250.00", table.cell(0, 2));
    }

    @Test
    void blankCellsAreReadAsNullAndShortRowsArePadded() throws IOException {
        String csv = "a,b,c\n"
            + "1,,\n"
            + "2\n";

        RawTable table = DelimitedTableReader.csv().read(new StringReader(csv), "inline.csv");

        assertEquals(2, table.rowCount());
        assertNull(table.cell(0, 1));
        assertNull(table.cell(0, 2));
        assertEquals("2", table.cell(1, 0));
        assertNull(table.cell(1, 2));
    }

    @Test
    void headerOnlyInputHasNoRows() throws IOException {
        RawTable table = DelimitedTableReader.csv().read(new StringReader("a,b\n"), "inline.csv");

        assertEquals(List.of("a", "b"), table.headers());
        assertTrue(table.isEmpty());
        assertTrue(DelimitedTableReader.csv().read(new StringReader(""), "blank.csv").isEmpty());
    }

    @Test
    void unterminatedQuoteIsReportedAsIOException() {
        String csv = "a,b\n\"open,2\n";

        IOException ex = assertThrows(IOException.class,
            () -> DelimitedTableReader.csv().read(new StringReader(csv), "broken.csv"));
        assertTrue(ex.getMessage().contains("broken.csv"));
    }

    @Test
    void picksDelimiterFromExtension() throws IOException {
        RawTable table = DelimitedTableReader.forFile(Path.of("exports", "tracking.txt"))
            .read(new StringReader("carrier\ttracking\nUPS\t1Z1\n"), "tracking.txt");

        assertEquals(List.of("carrier", "tracking"), table.headers());
        assertEquals("1Z1", table.cell(0, 1));
    }

    @Test
    void shopifyFixtureFeedsOrdersPipeline() throws Exception {
        RawTable raw = DelimitedTableReader.csv().read(fixture("ingest/shopify_orders.csv"));

        assertEquals("Name", raw.headers().get(0));
        assertEquals(3, raw.rowCount());

        NormalizationResult<OrderLine> result = new OrdersNormalizer().normalize(raw, "acct", "store");

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.data().size());
        OrderLine first = result.data().records().get(0);
        assertEquals("shopify", first.platform());
        assertEquals(Instant.parse("2024-01-05T15:00:00Z"), first.orderDatetimeUtc());
        assertEquals("UN", first.customerCountry());
        OrderLine second = result.data().records().get(1);
        assertEquals("XYZ-9", second.sku());
        assertNull(second.orderRevenue());
        assertEquals("CAD", second.currency());
    }

    @Test
    void supplierFixtureFeedsShipmentsPipeline() throws Exception {
        Path file = fixture("ingest/supplier_shipments.tsv");
        RawTable raw = DelimitedTableReader.forFile(file).read(file);

        NormalizationResult<ShipmentLine> result = new ShipmentsNormalizer().normalize(raw, "acct", "store");

        ShipmentLine line = result.data().records().get(0);
        assertEquals(ShipmentLine.UNKNOWN_SUPPLIER, line.supplierName());
        assertEquals("ABC-1", line.sku());
        assertEquals(2, line.quantityShipped());
        assertEquals(Instant.parse("2024-01-07T00:00:00Z"), line.shipDatetimeUtc());
        assertEquals("", line.shipFromCountry());
    }

    private static Path fixture(String name) throws Exception {
        URL url = Thread.currentThread().getContextClassLoader().getResource(name);
        assertNotNull(url, "Missing test fixture " + name);
        return Path.of(url.toURI());
    }
}
