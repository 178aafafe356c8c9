package com.osman.ingest.core.normalize;

import com.osman.ingest.core.model.CanonicalTable;
import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.TrackingEvent;
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
import static com.osman.ingest.core.normalize.NormalizerSupport.UTC_TIMESTAMP;
import static com.osman.ingest.core.normalize.NormalizerSupport.hasText;
import static com.osman.ingest.core.normalize.NormalizerSupport.text;
import static com.osman.ingest.core.normalize.NormalizerSupport.timestamp;
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
 * Converts carrier tracking exports into canonical {@link TrackingEvent}s.
 * <p>
 * Unlike orders and shipments, an empty tracking export produces an empty validation report.
 */
public final class TrackingNormalizer {
    private static final Logger LOGGER = AppLogger.get();

    public static final String TABLE = "tracking";

    static final List<ColumnRule> REQUIRED = List.of(
        ColumnRule.required(TRACKING_NUMBER)
    );

    public NormalizationResult<TrackingEvent> normalize(RawTable raw, String accountId, String storeId) {
        if (NormalizerSupport.isEmptyInput(raw)) {
            LOGGER.fine("Tracking input is empty; nothing to normalize.");
            return new NormalizationResult<>(CanonicalTable.empty(TABLE, TrackingEvent.COLUMNS),
                ValidationReport.empty());
        }

        WorkingTable table = NormalizerSupport.canonicalHeaders(raw);
        table.renameColumns(ColumnAliases.TRACKING);
        NormalizerSupport.ensureRequiredColumns(table, REQUIRED);
        NormalizerSupport.stampTenant(table, accountId, storeId);

        table.transform(CARRIER, TRIMMED);
        table.transform(TRACKING_NUMBER, TRIMMED);
        table.transform(ORDER_ID, TRIMMED);
        table.transform(SUPPLIER_ORDER_ID, TRIMMED);
        table.transform(TRACKING_STATUS_RAW, TRIMMED);
        table.transform(TRACKING_STATUS_NORMALIZED, TRIMMED);
        table.transform(LAST_UPDATE_UTC, UTC_TIMESTAMP);
        table.transform(DELIVERY_DATE_UTC, UTC_TIMESTAMP);
        table.transform(DELIVERY_EXCEPTION, TRIMMED);

        List<String> errors = RequiredColumnValidator.validate(table, REQUIRED, TABLE);

        int dropped = table.retainRows(row -> hasText(row, TRACKING_NUMBER));
        if (dropped > 0) {
            LOGGER.fine("Dropped %d tracking row(s) without a tracking number.".formatted(dropped));
        }

        List<TrackingEvent> events = project(table);
        LOGGER.info("Normalized %d tracking event(s) for %s/%s (%d dropped)."
            .formatted(events.size(), accountId, storeId, dropped));
        return new NormalizationResult<>(new CanonicalTable<>(TABLE, TrackingEvent.COLUMNS, events),
            new ValidationReport(errors));
    }

    private static List<TrackingEvent> project(WorkingTable table) {
        List<TrackingEvent> events = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            events.add(new TrackingEvent(
                text(table, i, ACCOUNT_ID),
                text(table, i, STORE_ID),
                text(table, i, CARRIER),
                text(table, i, TRACKING_NUMBER),
                text(table, i, ORDER_ID),
                text(table, i, SUPPLIER_ORDER_ID),
                text(table, i, TRACKING_STATUS_RAW),
                text(table, i, TRACKING_STATUS_NORMALIZED),
                timestamp(table, i, LAST_UPDATE_UTC),
                timestamp(table, i, DELIVERY_DATE_UTC),
                text(table, i, DELIVERY_EXCEPTION)
            ));
        }
        return events;
    }
}
