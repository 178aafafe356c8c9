package com.osman.ingest.cli;

import com.osman.ingest.config.ConfigService;
import com.osman.ingest.config.IngestSettings;
import com.osman.ingest.core.csv.RawInputResolver;
import com.osman.ingest.core.json.CanonicalJsonWriter;
import com.osman.ingest.core.normalize.IngestionRun;
import com.osman.ingest.core.normalize.IngestionService;
import com.osman.ingest.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLI workflow that normalizes the exports found in a data directory and writes the canonical tables as JSON.
 * <p>
 * Usage: {@code NormalizeTool <data-dir> [output.json]}. The data directory may also be given with
 * {@code -Dingest.dataDir}; tenant and order defaults come from {@link ConfigService}.
 */
public final class NormalizeTool {
    private static final Logger LOGGER = AppLogger.get();

    static final String DATA_DIR_PROPERTY = "ingest.dataDir";
    static final String DEFAULT_OUTPUT = "canonical-run.json";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 1;

    private NormalizeTool() {}

    public static void main(String[] args) {
        ConfigService config = ConfigService.getInstance();
        IngestSettings settings = config.resolve();
        int code = run(args, settings);
        if (code != EXIT_OK) {
            System.exit(code);
        }
        config.rememberTenant(settings.accountId(), settings.storeId());
    }

    static int run(String[] args, IngestSettings settings) {
        Path dataDir = resolveDataDir(args);
        if (dataDir == null) {
            LOGGER.severe("Usage: NormalizeTool <data-dir> [output.json] (or -D" + DATA_DIR_PROPERTY + "=<dir>)");
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(dataDir)) {
            LOGGER.severe("Data directory does not exist: " + dataDir);
            return EXIT_USAGE;
        }
        Path output = args != null && args.length > 1 && !args[1].isBlank()
            ? Path.of(args[1].trim())
            : dataDir.resolve(DEFAULT_OUTPUT);

        try {
            RawInputResolver.RawInputs inputs = new RawInputResolver(dataDir).loadAll();
            IngestionRun run = new IngestionService().run(inputs.orders(), inputs.shipments(), inputs.tracking(), settings);
            for (String error : run.validationReport().errors()) {
                LOGGER.warning(error);
            }
            CanonicalJsonWriter.write(run, output);
            LOGGER.info("Canonical tables written to " + output);
            return EXIT_OK;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Normalization failed: " + ex.getMessage(), ex);
            return EXIT_IO;
        }
    }

    private static Path resolveDataDir(String[] args) {
        // 1) CLI argument
        if (args != null && args.length > 0 && args[0] != null && !args[0].isBlank()) {
            return Path.of(args[0].trim());
        }
        // 2) System property: -Dingest.dataDir=/path/to/exports
        String property = System.getProperty(DATA_DIR_PROPERTY);
        if (property != null && !property.isBlank()) {
            return Path.of(property.trim());
        }
        return null;
    }
}
