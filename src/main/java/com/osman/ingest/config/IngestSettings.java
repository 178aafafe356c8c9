package com.osman.ingest.config;

import java.util.Objects;

/**
 * Tenant and run parameters handed to the normalization pipelines.
 *
 * @param accountId        tenant account stamped on every canonical row
 * @param storeId          tenant store stamped on every canonical row
 * @param platformHint     platform the orders export is believed to come from
 * @param defaultCurrency  currency used when the orders export has no currency column
 * @param promisedShipDays constant stamped on every order line
 * @param parallel         run the three pipelines concurrently
 */
public record IngestSettings(String accountId,
                             String storeId,
                             String platformHint,
                             String defaultCurrency,
                             int promisedShipDays,
                             boolean parallel) {

    public static final String DEFAULT_ACCOUNT_ID = "default";
    public static final String DEFAULT_STORE_ID = "default";
    public static final String DEFAULT_PLATFORM_HINT = "shopify";
    public static final String DEFAULT_CURRENCY = "USD";
    public static final int DEFAULT_PROMISED_SHIP_DAYS = 3;

    public IngestSettings {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(storeId, "storeId");
        platformHint = platformHint == null ? "" : platformHint;
        defaultCurrency = defaultCurrency == null ? DEFAULT_CURRENCY : defaultCurrency;
    }

    public static IngestSettings defaults() {
        return new IngestSettings(DEFAULT_ACCOUNT_ID, DEFAULT_STORE_ID, DEFAULT_PLATFORM_HINT,
            DEFAULT_CURRENCY, DEFAULT_PROMISED_SHIP_DAYS, false);
    }
}
