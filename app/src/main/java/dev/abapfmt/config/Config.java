package dev.abapfmt.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * <p>An empty file list means standard input.
 */
public record Config(
        RunMode mode,
        LogFormat logFormat,
        FormatOptions formatOptions,
        List<Path> files
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(formatOptions, "formatOptions");
        files = files == null ? List.of() : List.copyOf(files);
        if (mode == RunMode.WRITE && files.isEmpty()) {
            throw new IllegalArgumentException("--mode write needs at least one file");
        }
    }

    public boolean readsStandardInput() {
        return files.isEmpty();
    }
}
