package com.sensorstats.model;

import java.util.Locale;

/**
 * Canonical form for location and sensor strings.
 *
 * <p>Stored readings and query parameters both go through {@link #canonical(String)};
 * if the two ever diverged, filters would silently stop matching.
 */
public final class FieldNormalizer {

    private FieldNormalizer() {
    }

    /**
     * Trim and lower-case. {@code null} becomes the empty string.
     */
    public static String canonical(String raw) {
        if (raw == null) return "";
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Same as {@link #canonical(String)}, but a blank input means "absent" and yields {@code null}.
     */
    public static String canonicalOrNull(String raw) {
        String canonical = canonical(raw);
        return canonical.isEmpty() ? null : canonical;
    }
}
