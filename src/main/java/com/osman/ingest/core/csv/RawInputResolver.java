package com.osman.ingest.core.csv;

import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Locates the order, shipment and tracking exports inside a data directory by their conventional base names.
 */
public final class RawInputResolver {
    private static final Logger LOGGER = AppLogger.get();

    public static final String ORDERS = "orders";
    public static final String SHIPMENTS = "shipments";
    public static final String TRACKING = "tracking";

    private static final List<String> EXTENSIONS = List.of(".csv", ".tsv", ".txt");

    private final Path dataDirectory;

    public RawInputResolver(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public Optional<Path> locate(String baseName) {
        for (String extension : EXTENSIONS) {
            Path candidate = dataDirectory.resolve(baseName + extension);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Load one export; a missing file resolves to {@code null}, which the pipelines treat as empty input.
     */
    public RawTable load(String baseName) throws IOException {
        Optional<Path> file = locate(baseName);
        if (file.isEmpty()) {
            LOGGER.warning("No %s export found in %s.".formatted(baseName, dataDirectory));
            return null;
        }
        return DelimitedTableReader.forFile(file.get()).read(file.get());
    }

    public RawInputs loadAll() throws IOException {
        return new RawInputs(load(ORDERS), load(SHIPMENTS), load(TRACKING));
    }

    /**
     * The three raw exports of a run; any of them may be {@code null}.
     */
    public record RawInputs(RawTable orders, RawTable shipments, RawTable tracking) {
    }
}
