package dev.abapfmt.rules;

import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.model.Comment;
import java.util.Objects;

/**
 * Spacing around the comment sign: one space after {@code "} before a letter or digit, and the separator between code
 * and an appended comment.
 */
public class CommentNormalizer {

    private final FormatOptions options;

    public CommentNormalizer(FormatOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public String normalize(Comment comment) {
        return normalize(comment.value());
    }

    /**
     * Leading whitespace is kept. Pseudo comments and {@code *} comments come back unchanged.
     */
    public String normalize(String value) {
        if (!options.spaceAfterCommentSign()) {
            return value;
        }
        String rest = value.stripLeading();
        String leading = value.substring(0, value.length() - rest.length());
        if (rest.length() < 2 || rest.charAt(0) != Comment.COMMENT_SIGN) {
            return value;
        }
        char next = rest.charAt(1);
        if (next == '#' || !isAsciiLetterOrDigit(next)) {
            return value;
        }
        return leading + Comment.COMMENT_SIGN + " " + rest.substring(1);
    }

    /**
     * Appends the normalized comment to a rendered code line.
     */
    public String append(String line, Comment comment) {
        String formatted = normalize(comment.value().stripLeading());
        if (!options.spaceBeforeCommentSign() || line.isEmpty() || line.endsWith(" ")) {
            return line + formatted;
        }
        return line + " " + formatted;
    }

    private static boolean isAsciiLetterOrDigit(char value) {
        return (value >= 'a' && value <= 'z') || (value >= 'A' && value <= 'Z') || (value >= '0' && value <= '9');
    }
}
