package com.osman.ingest.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    private static final List<String> PROPERTIES = List.of(
        ConfigService.ACCOUNT_ID_PROPERTY,
        ConfigService.STORE_ID_PROPERTY,
        ConfigService.PLATFORM_HINT_PROPERTY,
        ConfigService.CURRENCY_PROPERTY,
        ConfigService.PROMISED_DAYS_PROPERTY,
        ConfigService.PARALLEL_PROPERTY
    );

    private PreferencesStore preferences;

    @BeforeEach
    void setUp() {
        PROPERTIES.forEach(System::clearProperty);
        preferences = PreferencesStore.at("com/osman/ingest/test");
        preferences.clear();
    }

    @AfterEach
    void tearDown() {
        PROPERTIES.forEach(System::clearProperty);
        preferences.clear();
    }

    @Test
    void fallsBackToDefaults() {
        IngestSettings settings = ConfigService.using(preferences).resolve();

        assertEquals(IngestSettings.defaults(), settings);
        assertFalse(settings.parallel());
    }

    @Test
    void rememberedTenantIsUsedOnNextResolve() {
        ConfigService config = ConfigService.using(preferences);

        config.rememberTenant("acct-7", "store-7");
        IngestSettings settings = config.resolve();

        assertEquals("acct-7", settings.accountId());
        assertEquals("store-7", settings.storeId());
    }

    @Test
    void systemPropertiesOverridePreferences() {
        ConfigService config = ConfigService.using(preferences);
        config.rememberTenant("acct-7", "store-7");
        System.setProperty(ConfigService.ACCOUNT_ID_PROPERTY, " acct-override ");
        System.setProperty(ConfigService.PLATFORM_HINT_PROPERTY, "woocommerce");
        System.setProperty(ConfigService.CURRENCY_PROPERTY, "EUR");
        System.setProperty(ConfigService.PROMISED_DAYS_PROPERTY, "5");
        System.setProperty(ConfigService.PARALLEL_PROPERTY, "true");

        IngestSettings settings = config.resolve();

        assertEquals("acct-override", settings.accountId());
        assertEquals("store-7", settings.storeId());
        assertEquals("woocommerce", settings.platformHint());
        assertEquals("EUR", settings.defaultCurrency());
        assertEquals(5, settings.promisedShipDays());
        assertTrue(settings.parallel());
    }

    @Test
    void invalidPromisedDaysFallBackToDefault() {
        System.setProperty(ConfigService.PROMISED_DAYS_PROPERTY, "three");

        IngestSettings settings = ConfigService.using(preferences).resolve();

        assertEquals(IngestSettings.DEFAULT_PROMISED_SHIP_DAYS, settings.promisedShipDays());
    }
}
