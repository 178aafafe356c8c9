package com.osman.ingest.config;

import com.osman.ingest.logging.AppLogger;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Central entry point for resolving ingestion settings with overrides and persisted preferences.
 * <p>
 * Lookup order per key: system property, persisted preference, built-in default.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String ACCOUNT_ID_PROPERTY = "ingest.accountId";
    static final String STORE_ID_PROPERTY = "ingest.storeId";
    static final String PLATFORM_HINT_PROPERTY = "ingest.platformHint";
    static final String CURRENCY_PROPERTY = "ingest.defaultCurrency";
    static final String PROMISED_DAYS_PROPERTY = "ingest.promisedShipDays";
    static final String PARALLEL_PROPERTY = "ingest.parallel";

    private static final String PREF_KEY_ACCOUNT_ID = "tenant.account";
    private static final String PREF_KEY_STORE_ID = "tenant.store";
    private static final String PREF_KEY_PLATFORM_HINT = "orders.platformHint";
    private static final String PREF_KEY_CURRENCY = "orders.defaultCurrency";
    private static final String PREF_KEY_PROMISED_DAYS = "orders.promisedShipDays";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    private ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public static ConfigService using(PreferencesStore preferences) {
        return new ConfigService(preferences);
    }

    public IngestSettings resolve() {
        return new IngestSettings(
            lookup(ACCOUNT_ID_PROPERTY, PREF_KEY_ACCOUNT_ID).orElse(IngestSettings.DEFAULT_ACCOUNT_ID),
            lookup(STORE_ID_PROPERTY, PREF_KEY_STORE_ID).orElse(IngestSettings.DEFAULT_STORE_ID),
            lookup(PLATFORM_HINT_PROPERTY, PREF_KEY_PLATFORM_HINT).orElse(IngestSettings.DEFAULT_PLATFORM_HINT),
            lookup(CURRENCY_PROPERTY, PREF_KEY_CURRENCY).orElse(IngestSettings.DEFAULT_CURRENCY),
            resolvePromisedDays(),
            Boolean.parseBoolean(System.getProperty(PARALLEL_PROPERTY, "false").trim())
        );
    }

    public void rememberTenant(String accountId, String storeId) {
        if (accountId == null || storeId == null) return;
        preferences.putString(PREF_KEY_ACCOUNT_ID, accountId);
        preferences.putString(PREF_KEY_STORE_ID, storeId);
    }

    private int resolvePromisedDays() {
        Optional<String> raw = lookup(PROMISED_DAYS_PROPERTY, PREF_KEY_PROMISED_DAYS);
        if (raw.isEmpty()) {
            return IngestSettings.DEFAULT_PROMISED_SHIP_DAYS;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring invalid promised ship days '%s'; using %d."
                .formatted(raw.get(), IngestSettings.DEFAULT_PROMISED_SHIP_DAYS));
            return IngestSettings.DEFAULT_PROMISED_SHIP_DAYS;
        }
    }

    private Optional<String> lookup(String property, String preferenceKey) {
        String override = System.getProperty(property);
        if (override != null && !override.isBlank()) {
            return Optional.of(override.trim());
        }
        return preferences.getString(preferenceKey);
    }
}
