package com.osman.ingest.config;

import com.osman.ingest.logging.AppLogger;

import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the last used tenant and run defaults survive restarts.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/osman/ingest";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    /**
     * Store rooted at a caller-chosen node, used to keep tests away from the real user preferences.
     */
    public static PreferencesStore at(String nodePath) {
        return new PreferencesStore(Preferences.userRoot().node(nodePath));
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    public void clear() {
        try {
            delegate.clear();
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Unable to clear preferences: " + ex.getMessage());
        }
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Unable to flush preferences: " + ex.getMessage());
        }
    }
}
