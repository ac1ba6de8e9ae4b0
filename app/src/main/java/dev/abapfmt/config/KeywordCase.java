package dev.abapfmt.config;

import java.util.Locale;

/**
 * Case applied to ABAP keywords.
 */
public enum KeywordCase {
    UPPER,
    LOWER;

    public static KeywordCase from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UPPER;
        }
        for (KeywordCase value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported keyword case: " + raw);
    }

    public String apply(String keyword) {
        return this == UPPER ? keyword.toUpperCase(Locale.ROOT) : keyword.toLowerCase(Locale.ROOT);
    }
}
