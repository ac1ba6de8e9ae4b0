package dev.abapfmt.format;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of formatting one document.
 *
 * @param fileName name used in log lines
 * @param text resulting document text
 * @param formatted {@code false} when the document was passed through with trailing whitespace trimmed only
 * @param reason why the document was passed through, if it was
 */
public record FormatResult(String fileName, String text, boolean formatted, Optional<String> reason) {

    public FormatResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(text, "text");
        reason = reason == null ? Optional.empty() : reason;
    }

    public static FormatResult formatted(String fileName, String text) {
        return new FormatResult(fileName, text, true, Optional.empty());
    }

    public static FormatResult passedThrough(String fileName, String text, String reason) {
        return new FormatResult(fileName, text, false, Optional.ofNullable(reason));
    }

    public boolean differsFrom(String original) {
        return !text.equals(original);
    }
}
