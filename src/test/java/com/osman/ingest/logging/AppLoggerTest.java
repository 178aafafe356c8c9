package com.osman.ingest.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class AppLoggerTest {

    @Test
    void sharesOneLoggerWithoutParentHandlers() {
        assertSame(AppLogger.get(), AppLogger.get());
        assertFalse(AppLogger.get().getUseParentHandlers());
        assertEquals(1, AppLogger.get().getHandlers().length);
    }

    @Test
    void resolvesConfiguredLevel() {
        assertEquals(Level.FINE, AppLogger.resolveLevel(" fine "));
        assertEquals(Level.WARNING, AppLogger.resolveLevel("WARNING"));
        assertEquals(Level.INFO, AppLogger.resolveLevel(null));
        assertEquals(Level.INFO, AppLogger.resolveLevel("chatty"));
    }
}
