package com.osman.ingest.core.schema;

import com.osman.ingest.core.table.HeaderCanonicalizer;
import com.osman.ingest.core.table.RawTable;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Scores a header set against columns that Shopify order exports are known to carry.
 */
public final class PlatformDetector {
    public static final String SHOPIFY = "shopify";

    /** Three overlapping columns are enough to tolerate renamed or dropped columns. */
    public static final int SHOPIFY_THRESHOLD = 3;

    public static final Set<String> SHOPIFY_SIGNALS = Set.of(
        "name",
        "created at",
        "lineitem sku",
        "lineitem quantity",
        "variant sku",
        "shipping country",
        "shipping province",
        "financial status",
        "fulfillment status"
    );

    private PlatformDetector() {
    }

    public static int score(Collection<String> headers) {
        Set<String> canonical = new HashSet<>();
        for (String header : headers) {
            canonical.add(HeaderCanonicalizer.canonicalize(header));
        }
        canonical.retainAll(SHOPIFY_SIGNALS);
        return canonical.size();
    }

    public static boolean isShopify(Collection<String> headers) {
        return score(headers) >= SHOPIFY_THRESHOLD;
    }

    /**
     * A {@code shopify} hint (any case) forces a positive answer regardless of the header score.
     */
    public static boolean isShopify(Collection<String> headers, String platformHint) {
        return isShopifyHint(platformHint) || isShopify(headers);
    }

    public static boolean isShopify(RawTable table, String platformHint) {
        return isShopify(table.headers(), platformHint);
    }

    static boolean isShopifyHint(String platformHint) {
        return platformHint != null && platformHint.toLowerCase(Locale.ROOT).equals(SHOPIFY);
    }
}
