package com.osman.ingest.core.normalize;

import com.osman.ingest.core.coerce.TypeCoercion;
import com.osman.ingest.core.model.CanonicalTable;
import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.OrderLine;
import com.osman.ingest.core.model.ValidationReport;
import com.osman.ingest.core.schema.ColumnAliases;
import com.osman.ingest.core.schema.ColumnRule;
import com.osman.ingest.core.schema.PlatformDetector;
import com.osman.ingest.core.schema.RequiredColumnValidator;
import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.core.table.WorkingTable;
import com.osman.ingest.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static com.osman.ingest.core.normalize.NormalizerSupport.TRIMMED;
import static com.osman.ingest.core.normalize.NormalizerSupport.TRIMMED_UPPER;
import static com.osman.ingest.core.normalize.NormalizerSupport.UTC_TIMESTAMP;
import static com.osman.ingest.core.normalize.NormalizerSupport.decimal;
import static com.osman.ingest.core.normalize.NormalizerSupport.hasText;
import static com.osman.ingest.core.normalize.NormalizerSupport.integer;
import static com.osman.ingest.core.normalize.NormalizerSupport.text;
import static com.osman.ingest.core.normalize.NormalizerSupport.timestamp;
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
 * Converts an arbitrary order export into canonical {@link OrderLine}s, one per ordered SKU.
 * <p>
 * Shopify exports are recognised by their header set (or by a {@code shopify} platform hint) and have their
 * columns aliased; other exports are expected to carry canonical column names already. Rows without an order id or
 * SKU are dropped. Every other bad value degrades to a default and the row survives.
 */
public final class OrdersNormalizer {
    private static final Logger LOGGER = AppLogger.get();

    public static final String TABLE = "orders";
    public static final String EMPTY_INPUT_ERROR = "[orders] Input orders dataframe is empty.";
    static final String OTHER_PLATFORM = "other";

    static final List<ColumnRule> REQUIRED = List.of(
        ColumnRule.required(ORDER_ID),
        ColumnRule.required(ORDER_DATETIME_UTC),
        ColumnRule.required(SKU),
        ColumnRule.required(QUANTITY_ORDERED),
        ColumnRule.required(CUSTOMER_COUNTRY)
    );

    public NormalizationResult<OrderLine> normalize(RawTable raw, String accountId, String storeId) {
        return normalize(raw, accountId, storeId, OrderNormalizationOptions.defaults());
    }

    public NormalizationResult<OrderLine> normalize(RawTable raw,
                                                    String accountId,
                                                    String storeId,
                                                    OrderNormalizationOptions options) {
        Objects.requireNonNull(options, "options");
        if (NormalizerSupport.isEmptyInput(raw)) {
            LOGGER.fine("Orders input is empty; nothing to normalize.");
            return new NormalizationResult<>(CanonicalTable.empty(TABLE, OrderLine.COLUMNS),
                ValidationReport.of(EMPTY_INPUT_ERROR));
        }

        WorkingTable table = NormalizerSupport.canonicalHeaders(raw);

        boolean shopify = PlatformDetector.isShopify(raw, options.platformHint());
        if (shopify) {
            int renamed = table.renameColumns(ColumnAliases.SHOPIFY_ORDERS);
            LOGGER.fine("Orders treated as Shopify export; %d column(s) aliased.".formatted(renamed));
        }

        NormalizerSupport.ensureRequiredColumns(table, REQUIRED);

        NormalizerSupport.stampTenant(table, accountId, storeId);
        table.fill(PLATFORM, resolvePlatform(shopify, options.platformHint()));

        boolean hasRevenue = table.hasColumn(ORDER_REVENUE);
        boolean hasCurrency = table.hasColumn(CURRENCY);
        boolean hasShippingMethod = table.hasColumn(SHIPPING_METHOD);

        table.transform(ORDER_ID, TRIMMED);
        table.transform(SKU, TRIMMED_UPPER);
        table.transform(ORDER_DATETIME_UTC, UTC_TIMESTAMP);
        table.transform(QUANTITY_ORDERED, OrdersNormalizer::coerceQuantity);
        table.transform(CUSTOMER_COUNTRY, OrdersNormalizer::coerceCountry);
        table.transform(CUSTOMER_STATE, TRIMMED);

        if (hasRevenue) {
            table.transform(ORDER_REVENUE, TypeCoercion::toDouble);
        } else {
            table.fill(ORDER_REVENUE, null);
        }
        if (hasCurrency) {
            table.transform(CURRENCY, TRIMMED_UPPER);
        } else {
            table.fill(CURRENCY, options.defaultCurrency());
        }
        if (hasShippingMethod) {
            table.transform(SHIPPING_METHOD, TRIMMED);
        } else {
            table.fill(SHIPPING_METHOD, "");
        }
        table.fill(PROMISED_SHIP_DAYS, options.promisedShipDays());

        List<String> errors = RequiredColumnValidator.validate(table, REQUIRED, TABLE);

        int dropped = table.retainRows(row -> hasText(row, ORDER_ID) && hasText(row, SKU));
        if (dropped > 0) {
            LOGGER.fine("Dropped %d order row(s) without order id or SKU.".formatted(dropped));
        }

        List<OrderLine> lines = project(table, options);
        LOGGER.info("Normalized %d order line(s) for %s/%s (%d dropped, %d validation error(s))."
            .formatted(lines.size(), accountId, storeId, dropped, errors.size()));
        return new NormalizationResult<>(new CanonicalTable<>(TABLE, OrderLine.COLUMNS, lines),
            new ValidationReport(errors));
    }

    static String resolvePlatform(boolean shopify, String platformHint) {
        if (shopify) {
            return PlatformDetector.SHOPIFY;
        }
        return platformHint == null || platformHint.isEmpty() ? OTHER_PLATFORM : platformHint;
    }

    static Object coerceQuantity(Object value) {
        int quantity = TypeCoercion.toInteger(value, 1);
        return quantity <= 0 ? 1 : quantity;
    }

    /**
     * Uppercases and keeps the first two characters when there are at least two. Full country names are not mapped
     * to ISO codes, so {@code Canada} becomes {@code CA} but {@code United States} becomes {@code UN}.
     */
    static Object coerceCountry(Object value) {
        String country = (String) TRIMMED_UPPER.apply(value);
        return country.length() >= 2 ? country.substring(0, 2) : country;
    }

    private static List<OrderLine> project(WorkingTable table, OrderNormalizationOptions options) {
        List<OrderLine> lines = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            lines.add(new OrderLine(
                text(table, i, ACCOUNT_ID),
                text(table, i, STORE_ID),
                text(table, i, PLATFORM),
                text(table, i, ORDER_ID),
                timestamp(table, i, ORDER_DATETIME_UTC),
                text(table, i, SKU),
                integer(table, i, QUANTITY_ORDERED, 1),
                text(table, i, CUSTOMER_COUNTRY),
                text(table, i, CUSTOMER_STATE),
                decimal(table, i, ORDER_REVENUE),
                text(table, i, CURRENCY),
                text(table, i, SHIPPING_METHOD),
                integer(table, i, PROMISED_SHIP_DAYS, options.promisedShipDays())
            ));
        }
        return lines;
    }
}
