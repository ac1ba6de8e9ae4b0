package dev.abapfmt.config;

/**
 * Layout of colon chains. Only {@link #PRESERVE} has a defined behaviour; {@link #EXPAND} is accepted and formats
 * like {@link #PRESERVE}.
 */
public enum ChainFormatting {
    PRESERVE,
    EXPAND;

    public static ChainFormatting from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRESERVE;
        }
        for (ChainFormatting value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported chain formatting: " + raw);
    }
}
