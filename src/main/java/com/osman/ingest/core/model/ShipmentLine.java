package com.osman.ingest.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.osman.ingest.core.schema.CanonicalFields.ACCOUNT_ID;
import static com.osman.ingest.core.schema.CanonicalFields.CARRIER;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.QUANTITY_SHIPPED;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_DATETIME_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_FROM_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_TO_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.SKU;
import static com.osman.ingest.core.schema.CanonicalFields.STORE_ID;
import static com.osman.ingest.core.schema.CanonicalFields.SUPPLIER_NAME;
import static com.osman.ingest.core.schema.CanonicalFields.SUPPLIER_ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_NUMBER;

/**
 * One shipped SKU as reported by a supplier.
 */
public record ShipmentLine(String accountId,
                           String storeId,
                           String supplierName,
                           String supplierOrderId,
                           String orderId,
                           String sku,
                           int quantityShipped,
                           Instant shipDatetimeUtc,
                           String carrier,
                           String trackingNumber,
                           String shipFromCountry,
                           String shipToCountry) implements CanonicalRecord {

    public static final String UNKNOWN_SUPPLIER = "Unknown Supplier";

    public static final List<String> COLUMNS = List.of(
        ACCOUNT_ID,
        STORE_ID,
        SUPPLIER_NAME,
        SUPPLIER_ORDER_ID,
        ORDER_ID,
        SKU,
        QUANTITY_SHIPPED,
        SHIP_DATETIME_UTC,
        CARRIER,
        TRACKING_NUMBER,
        SHIP_FROM_COUNTRY,
        SHIP_TO_COUNTRY
    );

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ACCOUNT_ID, accountId);
        row.put(STORE_ID, storeId);
        row.put(SUPPLIER_NAME, supplierName);
        row.put(SUPPLIER_ORDER_ID, supplierOrderId);
        row.put(ORDER_ID, orderId);
        row.put(SKU, sku);
        row.put(QUANTITY_SHIPPED, quantityShipped);
        row.put(SHIP_DATETIME_UTC, shipDatetimeUtc);
        row.put(CARRIER, carrier);
        row.put(TRACKING_NUMBER, trackingNumber);
        row.put(SHIP_FROM_COUNTRY, shipFromCountry);
        row.put(SHIP_TO_COUNTRY, shipToCountry);
        return row;
    }
}
