package com.osman.ingest.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.osman.ingest.core.schema.CanonicalFields.ACCOUNT_ID;
import static com.osman.ingest.core.schema.CanonicalFields.CURRENCY;
import static com.osman.ingest.core.schema.CanonicalFields.CUSTOMER_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.CUSTOMER_STATE;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_DATETIME_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_REVENUE;
import static com.osman.ingest.core.schema.CanonicalFields.PLATFORM;
import static com.osman.ingest.core.schema.CanonicalFields.PROMISED_SHIP_DAYS;
import static com.osman.ingest.core.schema.CanonicalFields.QUANTITY_ORDERED;
import static com.osman.ingest.core.schema.CanonicalFields.SHIPPING_METHOD;
import static com.osman.ingest.core.schema.CanonicalFields.SKU;
import static com.osman.ingest.core.schema.CanonicalFields.STORE_ID;

/**
 * One ordered SKU.
 *
 * @param orderDatetimeUtc {@code null} when the export carried no parseable timestamp
 * @param orderRevenue     {@code null} when the export carried no numeric total
 */
public record OrderLine(String accountId,
                        String storeId,
                        String platform,
                        String orderId,
                        Instant orderDatetimeUtc,
                        String sku,
                        int quantityOrdered,
                        String customerCountry,
                        String customerState,
                        Double orderRevenue,
                        String currency,
                        String shippingMethod,
                        int promisedShipDays) implements CanonicalRecord {

    public static final List<String> COLUMNS = List.of(
        ACCOUNT_ID,
        STORE_ID,
        PLATFORM,
        ORDER_ID,
        ORDER_DATETIME_UTC,
        SKU,
        QUANTITY_ORDERED,
        CUSTOMER_COUNTRY,
        CUSTOMER_STATE,
        ORDER_REVENUE,
        CURRENCY,
        SHIPPING_METHOD,
        PROMISED_SHIP_DAYS
    );

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ACCOUNT_ID, accountId);
        row.put(STORE_ID, storeId);
        row.put(PLATFORM, platform);
        row.put(ORDER_ID, orderId);
        row.put(ORDER_DATETIME_UTC, orderDatetimeUtc);
        row.put(SKU, sku);
        row.put(QUANTITY_ORDERED, quantityOrdered);
        row.put(CUSTOMER_COUNTRY, customerCountry);
        row.put(CUSTOMER_STATE, customerState);
        row.put(ORDER_REVENUE, orderRevenue);
        row.put(CURRENCY, currency);
        row.put(SHIPPING_METHOD, shippingMethod);
        row.put(PROMISED_SHIP_DAYS, promisedShipDays);
        return row;
    }
}
