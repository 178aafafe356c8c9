package com.osman.ingest.core.normalize;

import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.OrderLine;
import com.osman.ingest.core.model.ShipmentLine;
import com.osman.ingest.core.model.TrackingEvent;
import com.osman.ingest.core.model.ValidationReport;

import java.time.Instant;

/**
 * Canonical tables of one tenant run, ready for reconciliation.
 */
public record IngestionRun(String accountId,
                           String storeId,
                           Instant completedAt,
                           NormalizationResult<OrderLine> orders,
                           NormalizationResult<ShipmentLine> shipments,
                           NormalizationResult<TrackingEvent> tracking) {

    /**
     * All validation messages in orders, shipments, tracking order.
     */
    public ValidationReport validationReport() {
        return orders.errors().plus(shipments.errors()).plus(tracking.errors());
    }
}
