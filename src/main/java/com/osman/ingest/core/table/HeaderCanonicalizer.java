package com.osman.ingest.core.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Trims (and optionally lowercases) column labels. Always returns a copy.
 */
public final class HeaderCanonicalizer {
    private HeaderCanonicalizer() {
    }

    public static RawTable trim(RawTable table) {
        return table.withHeaders(trimAll(table.headers(), false));
    }

    public static RawTable trimAndLowercase(RawTable table) {
        return table.withHeaders(trimAll(table.headers(), true));
    }

    public static String canonicalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> trimAll(List<String> headers, boolean lowercase) {
        List<String> result = new ArrayList<>(headers.size());
        for (String header : headers) {
            String trimmed = header == null ? "" : header.trim();
            result.add(lowercase ? trimmed.toLowerCase(Locale.ROOT) : trimmed);
        }
        return result;
    }
}
