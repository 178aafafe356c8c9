package com.osman.ingest.core.normalize;

import com.osman.ingest.config.IngestSettings;

/**
 * Order-only knobs of a normalization run.
 *
 * @param platformHint     platform the caller believes the export comes from; {@code shopify} forces Shopify aliasing
 * @param defaultCurrency  currency stamped when the export has no currency column
 * @param promisedShipDays constant stamped on every order line
 */
public record OrderNormalizationOptions(String platformHint, String defaultCurrency, int promisedShipDays) {

    public OrderNormalizationOptions {
        platformHint = platformHint == null ? "" : platformHint;
        defaultCurrency = defaultCurrency == null ? IngestSettings.DEFAULT_CURRENCY : defaultCurrency;
    }

    public static OrderNormalizationOptions defaults() {
        return new OrderNormalizationOptions(IngestSettings.DEFAULT_PLATFORM_HINT,
            IngestSettings.DEFAULT_CURRENCY, IngestSettings.DEFAULT_PROMISED_SHIP_DAYS);
    }

    public static OrderNormalizationOptions from(IngestSettings settings) {
        return new OrderNormalizationOptions(settings.platformHint(), settings.defaultCurrency(),
            settings.promisedShipDays());
    }
}
