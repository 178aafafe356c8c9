package com.osman.ingest.core.normalize;

import com.osman.ingest.config.IngestSettings;
import com.osman.ingest.core.model.NormalizationResult;
import com.osman.ingest.core.model.OrderLine;
import com.osman.ingest.core.model.ShipmentLine;
import com.osman.ingest.core.model.TrackingEvent;
import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.logging.AppLogger;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Logger;

/**
 * Stable entry point that normalizes the order, shipment and tracking exports of one tenant.
 * <p>
 * The pipelines share no state, so with {@link IngestSettings#parallel()} set they run on separate worker threads.
 */
public final class IngestionService {
    private static final Logger LOGGER = AppLogger.get();

    private final OrdersNormalizer ordersNormalizer = new OrdersNormalizer();
    private final ShipmentsNormalizer shipmentsNormalizer = new ShipmentsNormalizer();
    private final TrackingNormalizer trackingNormalizer = new TrackingNormalizer();

    public IngestionRun run(RawTable orders, RawTable shipments, RawTable tracking, IngestSettings settings) {
        Objects.requireNonNull(settings, "settings");
        String account = settings.accountId();
        String store = settings.storeId();
        OrderNormalizationOptions options = OrderNormalizationOptions.from(settings);

        IngestionRun run;
        if (settings.parallel()) {
            run = runParallel(orders, shipments, tracking, account, store, options);
        } else {
            run = new IngestionRun(account, store, Instant.now(),
                ordersNormalizer.normalize(orders, account, store, options),
                shipmentsNormalizer.normalize(shipments, account, store),
                trackingNormalizer.normalize(tracking, account, store));
        }
        LOGGER.info("Run for %s/%s finished: %d order line(s), %d shipment line(s), %d tracking event(s), %d message(s)."
            .formatted(account, store, run.orders().data().size(), run.shipments().data().size(),
                run.tracking().data().size(), run.validationReport().size()));
        return run;
    }

    private IngestionRun runParallel(RawTable orders,
                                     RawTable shipments,
                                     RawTable tracking,
                                     String account,
                                     String store,
                                     OrderNormalizationOptions options) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "IngestPool-Worker");
            t.setDaemon(true);
            return t;
        };
        ExecutorService pool = Executors.newFixedThreadPool(3, tf);
        try {
            Future<NormalizationResult<OrderLine>> orderResult =
                pool.submit(() -> ordersNormalizer.normalize(orders, account, store, options));
            Future<NormalizationResult<ShipmentLine>> shipmentResult =
                pool.submit(() -> shipmentsNormalizer.normalize(shipments, account, store));
            Future<NormalizationResult<TrackingEvent>> trackingResult =
                pool.submit(() -> trackingNormalizer.normalize(tracking, account, store));
            return new IngestionRun(account, store, Instant.now(),
                await(orderResult), await(shipmentResult), await(trackingResult));
        } finally {
            pool.shutdown();
        }
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a normalization pipeline", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Normalization pipeline failed", cause);
        }
    }
}
