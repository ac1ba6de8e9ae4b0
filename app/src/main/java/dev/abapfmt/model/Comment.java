package dev.abapfmt.model;

import java.util.Objects;

/**
 * A source comment. {@code inline} means the comment shares its source line with preceding code.
 */
public record Comment(String value, boolean inline, SourceSpan span) {

    public static final char COMMENT_SIGN = '"';
    public static final char LINE_COMMENT_SIGN = '*';

    public Comment {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(span, "span");
    }

    public Comment withValue(String newValue) {
        return new Comment(newValue, inline, span);
    }

    public Comment asInline(boolean newInline) {
        return new Comment(value, newInline, span);
    }

    public int line() {
        return span.startLine();
    }

    /**
     * Pseudo comments such as {@code "#EC NEEDED} carry a {@code #} right after the sign.
     */
    public boolean isPseudo() {
        String trimmed = value.stripLeading();
        return trimmed.length() > 1 && trimmed.charAt(0) == COMMENT_SIGN && trimmed.charAt(1) == '#';
    }

    /**
     * Full-line comments starting with {@code *} that ABAP only accepts in the first column.
     */
    public boolean isLineComment() {
        return !value.isEmpty() && value.charAt(0) == LINE_COMMENT_SIGN;
    }

    /**
     * Comment text without the sign and surrounding whitespace, or empty for a non-{@code "} comment.
     */
    public String body() {
        String trimmed = value.stripLeading();
        if (trimmed.isEmpty() || trimmed.charAt(0) != COMMENT_SIGN) {
            return "";
        }
        return trimmed.substring(1).strip();
    }
}
