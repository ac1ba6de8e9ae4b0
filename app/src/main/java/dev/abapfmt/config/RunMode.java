package dev.abapfmt.config;

/**
 * What the CLI does with formatted documents.
 */
public enum RunMode {
    STDOUT,
    WRITE,
    CHECK;

    public static RunMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STDOUT;
        }
        for (RunMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isCheck() {
        return this == CHECK;
    }
}
