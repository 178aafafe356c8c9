package com.osman.ingest.core.csv;

import com.osman.ingest.core.table.RawTable;
import com.osman.ingest.logging.AppLogger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Reads CSV or tab-separated exports into a {@link RawTable}.
 * <p>
 * The first record is the header row. Headers are kept positionally, so repeated or blank headers survive; blank
 * cells are read as {@code null}.
 */
public final class DelimitedTableReader {
    private static final Logger LOGGER = AppLogger.get();

    private static final char COMMA = ',';
    private static final char TAB = '\t';
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final char delimiter;

    private DelimitedTableReader(char delimiter) {
        this.delimiter = delimiter;
    }

    public static DelimitedTableReader csv() {
        return new DelimitedTableReader(COMMA);
    }

    public static DelimitedTableReader tsv() {
        return new DelimitedTableReader(TAB);
    }

    /**
     * Picks the delimiter from the file extension: {@code .tsv} and {@code .txt} are tab separated, anything else
     * is treated as CSV.
     */
    public static DelimitedTableReader forFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tsv") || name.endsWith(".txt") ? tsv() : csv();
    }

    /**
     * Parse the provided file path.
     *
     * @throws IOException if the file cannot be read or is not valid delimited text
     */
    public RawTable read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.getFileName().toString());
        }
    }

    public RawTable read(Reader reader, String sourceName) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(false)
            .build();

        try (CSVParser parser = format.parse(reader)) {
            List<String> headers = null;
            List<List<Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (headers == null) {
                    headers = toHeaders(record);
                    continue;
                }
                rows.add(toCells(record));
            }
            if (headers == null) {
                LOGGER.fine("No header row found in " + sourceName + ".");
                return RawTable.empty();
            }
            LOGGER.fine("Read %d row(s) with %d column(s) from %s.".formatted(rows.size(), headers.size(), sourceName));
            return RawTable.of(headers, rows);
        } catch (UncheckedIOException | IllegalStateException ex) {
            throw new IOException("Failed to parse " + sourceName + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> toHeaders(CSVRecord record) {
        List<String> headers = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            String header = record.get(i);
            if (i == 0 && header.startsWith(BYTE_ORDER_MARK)) {
                header = header.substring(BYTE_ORDER_MARK.length());
            }
            headers.add(header);
        }
        return headers;
    }

    private static List<Object> toCells(CSVRecord record) {
        List<Object> cells = new ArrayList<>(record.size());
        for (String value : record) {
            cells.add(value == null || value.isEmpty() ? null : value);
        }
        return cells;
    }
}
