package dev.abapfmt.writer;

import dev.abapfmt.format.FormatResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads ABAP source files and writes formatted documents back in place.
 */
public class DocumentWriter {

    public String read(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read source file: " + source, ex);
        }
    }

    /**
     * Replaces the file content with the formatted text.
     *
     * @return {@code false} when the file already held exactly that text and was left untouched
     */
    public boolean write(Path target, FormatResult result) {
        if (target == null || result == null) {
            throw new IllegalArgumentException("target and result must be provided");
        }
        String current = Files.exists(target) ? read(target) : null;
        if (!result.differsFrom(current)) {
            return false;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, result.text(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write formatted document: " + target, ex);
        }
    }
}
