package com.osman.ingest.core.schema;

/**
 * Canonical column names shared by the order, shipment and tracking tables.
 */
public final class CanonicalFields {
    public static final String ACCOUNT_ID = "account_id";
    public static final String STORE_ID = "store_id";
    public static final String PLATFORM = "platform";
    public static final String ORDER_ID = "order_id";
    public static final String ORDER_DATETIME_UTC = "order_datetime_utc";
    public static final String SKU = "sku";
    public static final String QUANTITY_ORDERED = "quantity_ordered";
    public static final String CUSTOMER_COUNTRY = "customer_country";
    public static final String CUSTOMER_STATE = "customer_state";
    public static final String ORDER_REVENUE = "order_revenue";
    public static final String CURRENCY = "currency";
    public static final String SHIPPING_METHOD = "shipping_method";
    public static final String PROMISED_SHIP_DAYS = "promised_ship_days";

    public static final String SUPPLIER_NAME = "supplier_name";
    public static final String SUPPLIER_ORDER_ID = "supplier_order_id";
    public static final String QUANTITY_SHIPPED = "quantity_shipped";
    public static final String SHIP_DATETIME_UTC = "ship_datetime_utc";
    public static final String CARRIER = "carrier";
    public static final String TRACKING_NUMBER = "tracking_number";
    public static final String SHIP_FROM_COUNTRY = "ship_from_country";
    public static final String SHIP_TO_COUNTRY = "ship_to_country";

    public static final String TRACKING_STATUS_RAW = "tracking_status_raw";
    public static final String TRACKING_STATUS_NORMALIZED = "tracking_status_normalized";
    public static final String LAST_UPDATE_UTC = "last_update_utc";
    public static final String DELIVERY_DATE_UTC = "delivery_date_utc";
    public static final String DELIVERY_EXCEPTION = "delivery_exception";

    private CanonicalFields() {
    }
}
