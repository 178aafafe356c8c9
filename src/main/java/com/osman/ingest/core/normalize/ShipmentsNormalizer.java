package com.osman.ingest.core.normalize;

import com.osman.ingest.core.coerce.TypeCoercion;
import com.osman.ingest.core.model.CanonicalTable;
import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.ShipmentLine;
import com.osman.ingest.core.model.ValidationReport;
import com.osman.ingest.core.schema.ColumnAliases;
import com.osman.ingest.core.schema.ColumnRule;
import com.osman.ingest.core.schema.RequiredColumnValidator;
import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.core.table.WorkingTable;
import com.osman.ingest.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.osman.ingest.core.normalize.NormalizerSupport.TRIMMED;
import static com.osman.ingest.core.normalize.NormalizerSupport.TRIMMED_UPPER;
import static com.osman.ingest.core.normalize.NormalizerSupport.UTC_TIMESTAMP;
import static com.osman.ingest.core.normalize.NormalizerSupport.hasText;
import static com.osman.ingest.core.normalize.NormalizerSupport.integer;
import static com.osman.ingest.core.normalize.NormalizerSupport.text;
import static com.osman.ingest.core.normalize.NormalizerSupport.timestamp;
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
 * Converts supplier shipment sheets into canonical {@link ShipmentLine}s, one per shipped SKU.
 * <p>
 * Supplier sheets are aliased unconditionally. Rows without a supplier order id or SKU are dropped.
 */
public final class ShipmentsNormalizer {
    private static final Logger LOGGER = AppLogger.get();

    public static final String TABLE = "shipments";
    public static final String EMPTY_INPUT_ERROR = "[shipments] Input shipments dataframe is empty.";

    static final List<ColumnRule> REQUIRED = List.of(
        ColumnRule.required(SUPPLIER_NAME),
        ColumnRule.required(SUPPLIER_ORDER_ID),
        ColumnRule.required(SKU),
        ColumnRule.required(QUANTITY_SHIPPED),
        ColumnRule.required(SHIP_DATETIME_UTC)
    );

    public NormalizationResult<ShipmentLine> normalize(RawTable raw, String accountId, String storeId) {
        if (NormalizerSupport.isEmptyInput(raw)) {
            LOGGER.fine("Shipments input is empty; nothing to normalize.");
            return new NormalizationResult<>(CanonicalTable.empty(TABLE, ShipmentLine.COLUMNS),
                ValidationReport.of(EMPTY_INPUT_ERROR));
        }

        WorkingTable table = NormalizerSupport.canonicalHeaders(raw);
        table.renameColumns(ColumnAliases.SHIPMENTS);
        NormalizerSupport.ensureRequiredColumns(table, REQUIRED);
        NormalizerSupport.stampTenant(table, accountId, storeId);

        table.transform(SUPPLIER_NAME, ShipmentsNormalizer::coerceSupplierName);
        table.transform(SUPPLIER_ORDER_ID, TRIMMED);
        table.transform(ORDER_ID, TRIMMED);
        table.transform(SKU, TRIMMED_UPPER);
        table.transform(QUANTITY_SHIPPED, value -> TypeCoercion.toInteger(value, 0));
        table.transform(SHIP_DATETIME_UTC, UTC_TIMESTAMP);
        table.transform(CARRIER, TRIMMED);
        table.transform(TRACKING_NUMBER, TRIMMED);
        table.transform(SHIP_FROM_COUNTRY, ShipmentsNormalizer::coerceCountry);
        table.transform(SHIP_TO_COUNTRY, ShipmentsNormalizer::coerceCountry);

        List<String> errors = RequiredColumnValidator.validate(table, REQUIRED, TABLE);

        int dropped = table.retainRows(row -> hasText(row, SUPPLIER_ORDER_ID) && hasText(row, SKU));
        if (dropped > 0) {
            LOGGER.fine("Dropped %d shipment row(s) without supplier order id or SKU.".formatted(dropped));
        }

        List<ShipmentLine> lines = project(table);
        LOGGER.info("Normalized %d shipment line(s) for %s/%s (%d dropped, %d validation error(s))."
            .formatted(lines.size(), accountId, storeId, dropped, errors.size()));
        return new NormalizationResult<>(new CanonicalTable<>(TABLE, ShipmentLine.COLUMNS, lines),
            new ValidationReport(errors));
    }

    static Object coerceSupplierName(Object value) {
        String name = TypeCoercion.toTrimmedString(value);
        return name.isEmpty() ? ShipmentLine.UNKNOWN_SUPPLIER : name;
    }

    /**
     * Uppercases and keeps at most the first two characters, whatever the input looks like.
     */
    static Object coerceCountry(Object value) {
        String country = (String) TRIMMED_UPPER.apply(value);
        return country.length() > 2 ? country.substring(0, 2) : country;
    }

    private static List<ShipmentLine> project(WorkingTable table) {
        List<ShipmentLine> lines = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            lines.add(new ShipmentLine(
                text(table, i, ACCOUNT_ID),
                text(table, i, STORE_ID),
                text(table, i, SUPPLIER_NAME),
                text(table, i, SUPPLIER_ORDER_ID),
                text(table, i, ORDER_ID),
                text(table, i, SKU),
                integer(table, i, QUANTITY_SHIPPED, 0),
                timestamp(table, i, SHIP_DATETIME_UTC),
                text(table, i, CARRIER),
                text(table, i, TRACKING_NUMBER),
                text(table, i, SHIP_FROM_COUNTRY),
                text(table, i, SHIP_TO_COUNTRY)
            ));
        }
        return lines;
    }
}
