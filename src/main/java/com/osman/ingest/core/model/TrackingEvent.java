package com.osman.ingest.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.osman.ingest.core.schema.CanonicalFields.ACCOUNT_ID;
import static com.osman.ingest.core.schema.CanonicalFields.CARRIER;
import static com.osman.ingest.core.schema.CanonicalFields.DELIVERY_DATE_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.DELIVERY_EXCEPTION;
import static com.osman.ingest.core.schema.CanonicalFields.LAST_UPDATE_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.STORE_ID;
import static com.osman.ingest.core.schema.CanonicalFields.SUPPLIER_ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_NUMBER;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_STATUS_NORMALIZED;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_STATUS_RAW;

/**
 * One carrier tracking record.
 */
public record TrackingEvent(String accountId,
                            String storeId,
                            String carrier,
                            String trackingNumber,
                            String orderId,
                            String supplierOrderId,
                            String trackingStatusRaw,
                            String trackingStatusNormalized,
                            Instant lastUpdateUtc,
                            Instant deliveryDateUtc,
                            String deliveryException) implements CanonicalRecord {

    public static final List<String> COLUMNS = List.of(
        ACCOUNT_ID,
        STORE_ID,
        CARRIER,
        TRACKING_NUMBER,
        ORDER_ID,
        SUPPLIER_ORDER_ID,
        TRACKING_STATUS_RAW,
        TRACKING_STATUS_NORMALIZED,
        LAST_UPDATE_UTC,
        DELIVERY_DATE_UTC,
        DELIVERY_EXCEPTION
    );

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ACCOUNT_ID, accountId);
        row.put(STORE_ID, storeId);
        row.put(CARRIER, carrier);
        row.put(TRACKING_NUMBER, trackingNumber);
        row.put(ORDER_ID, orderId);
        row.put(SUPPLIER_ORDER_ID, supplierOrderId);
        row.put(TRACKING_STATUS_RAW, trackingStatusRaw);
        row.put(TRACKING_STATUS_NORMALIZED, trackingStatusNormalized);
        row.put(LAST_UPDATE_UTC, lastUpdateUtc);
        row.put(DELIVERY_DATE_UTC, deliveryDateUtc);
        row.put(DELIVERY_EXCEPTION, deliveryException);
        return row;
    }
}
