package com.osman.ingest.core.schema;

import java.util.Map;

import static com.osman.ingest.core.schema.CanonicalFields.CARRIER;
import static com.osman.ingest.core.schema.CanonicalFields.CURRENCY;
import static com.osman.ingest.core.schema.CanonicalFields.CUSTOMER_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.CUSTOMER_STATE;
import static com.osman.ingest.core.schema.CanonicalFields.DELIVERY_DATE_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.DELIVERY_EXCEPTION;
import static com.osman.ingest.core.schema.CanonicalFields.LAST_UPDATE_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_DATETIME_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.ORDER_REVENUE;
import static com.osman.ingest.core.schema.CanonicalFields.QUANTITY_ORDERED;
import static com.osman.ingest.core.schema.CanonicalFields.QUANTITY_SHIPPED;
import static com.osman.ingest.core.schema.CanonicalFields.SHIPPING_METHOD;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_DATETIME_UTC;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_FROM_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.SHIP_TO_COUNTRY;
import static com.osman.ingest.core.schema.CanonicalFields.SKU;
import static com.osman.ingest.core.schema.CanonicalFields.SUPPLIER_NAME;
import static com.osman.ingest.core.schema.CanonicalFields.SUPPLIER_ORDER_ID;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_NUMBER;
import static com.osman.ingest.core.schema.CanonicalFields.TRACKING_STATUS_RAW;

/**
 * Lowercase source header to canonical field mappings, one table per pipeline.
 * <p>
 * Several source headers may point at the same field. When more than one of them is present in a single export,
 * the rightmost column is the one the pipelines read; values are never merged.
 */
public final class ColumnAliases {

    /** Applied to order exports only when they look like (or are hinted as) Shopify. */
    public static final Map<String, String> SHOPIFY_ORDERS = Map.ofEntries(
        Map.entry("name", ORDER_ID),
        Map.entry("order id", ORDER_ID),
        Map.entry("created at", ORDER_DATETIME_UTC),
        Map.entry("lineitem sku", SKU),
        Map.entry("variant sku", SKU),
        // product title as a last resort when the export has no SKU column
        Map.entry("lineitem name", SKU),
        Map.entry("lineitem quantity", QUANTITY_ORDERED),
        Map.entry("quantity", QUANTITY_ORDERED),
        Map.entry("shipping country", CUSTOMER_COUNTRY),
        Map.entry("shipping province", CUSTOMER_STATE),
        Map.entry("total", ORDER_REVENUE),
        Map.entry("subtotal", ORDER_REVENUE),
        Map.entry("currency", CURRENCY),
        Map.entry("shipping method", SHIPPING_METHOD),
        Map.entry("shipping line title", SHIPPING_METHOD)
    );

    public static final Map<String, String> SHIPMENTS = Map.ofEntries(
        Map.entry("supplier", SUPPLIER_NAME),
        Map.entry("supplier name", SUPPLIER_NAME),
        Map.entry("vendor", SUPPLIER_NAME),

        Map.entry("supplier order id", SUPPLIER_ORDER_ID),
        Map.entry("supplier_order_id", SUPPLIER_ORDER_ID),
        Map.entry("po", SUPPLIER_ORDER_ID),
        Map.entry("purchase order", SUPPLIER_ORDER_ID),

        Map.entry("order id", ORDER_ID),
        Map.entry("order_id", ORDER_ID),
        Map.entry("shopify order id", ORDER_ID),
        // suppliers sometimes paste the Shopify order name
        Map.entry("name", ORDER_ID),

        Map.entry("sku", SKU),
        Map.entry("item sku", SKU),
        Map.entry("lineitem sku", SKU),

        Map.entry("quantity", QUANTITY_SHIPPED),
        Map.entry("qty", QUANTITY_SHIPPED),
        Map.entry("quantity shipped", QUANTITY_SHIPPED),

        Map.entry("ship date", SHIP_DATETIME_UTC),
        Map.entry("shipped at", SHIP_DATETIME_UTC),
        Map.entry("ship_datetime_utc", SHIP_DATETIME_UTC),
        Map.entry("shipment date", SHIP_DATETIME_UTC),

        Map.entry("carrier", CARRIER),
        Map.entry("tracking", TRACKING_NUMBER),
        Map.entry("tracking number", TRACKING_NUMBER),
        Map.entry("tracking_number", TRACKING_NUMBER),

        Map.entry("from country", SHIP_FROM_COUNTRY),
        Map.entry("ship from country", SHIP_FROM_COUNTRY),
        Map.entry("to country", SHIP_TO_COUNTRY),
        Map.entry("ship to country", SHIP_TO_COUNTRY)
    );

    public static final Map<String, String> TRACKING = Map.ofEntries(
        Map.entry("carrier", CARRIER),
        Map.entry("tracking number", TRACKING_NUMBER),
        Map.entry("tracking", TRACKING_NUMBER),
        Map.entry("tracking_number", TRACKING_NUMBER),

        Map.entry("order id", ORDER_ID),
        Map.entry("supplier order id", SUPPLIER_ORDER_ID),

        Map.entry("status", TRACKING_STATUS_RAW),
        Map.entry("tracking status", TRACKING_STATUS_RAW),
        Map.entry("tracking_status_raw", TRACKING_STATUS_RAW),

        Map.entry("last update", LAST_UPDATE_UTC),
        Map.entry("last updated", LAST_UPDATE_UTC),
        Map.entry("last_update_utc", LAST_UPDATE_UTC),

        Map.entry("delivered at", DELIVERY_DATE_UTC),
        Map.entry("delivered", DELIVERY_DATE_UTC),
        Map.entry("delivery date", DELIVERY_DATE_UTC),
        Map.entry("delivery_date_utc", DELIVERY_DATE_UTC),

        Map.entry("exception", DELIVERY_EXCEPTION),
        Map.entry("delivery exception", DELIVERY_EXCEPTION)
    );

    private ColumnAliases() {
    }
}
