package dev.abapfmt.rules;

import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Number of spaces rendered between two tokens on the same output line.
 */
public class SpacingRules {

    private final FormatOptions options;

    public SpacingRules(FormatOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Override if present, never below the rule minimum; otherwise the original same-line gap, at least one space,
     * unless the minimum is zero.
     */
    public int spacesBefore(Token token, Token previous, FormattingContext context) {
        int minimum = minimumSpaces(token, previous);
        OptionalInt override = context.spaceOverride(token);
        if (override.isPresent()) {
            return Math.max(override.getAsInt(), minimum);
        }
        if (minimum == 0) {
            return 0;
        }
        return Math.max(originalGap(token, previous), 1);
    }

    public int minimumSpaces(Token token, Token previous) {
        if (previous == null) {
            return 0;
        }
        if (token.role() == TokenRole.PUNCTUATION && (token.isPeriod() || token.isComma())) {
            return options.spaceBeforePeriod() ? 1 : 0;
        }
        if (token.role() == TokenRole.COMMENT) {
            return options.spaceBeforeCommentSign() ? 1 : 0;
        }
        if (token.role() == TokenRole.COLON || token.role() == TokenRole.ARROW
                || previous.role() == TokenRole.ARROW) {
            return 0;
        }
        if (token.isClosingBracket() && previous.isOpeningBracket()) {
            return 0;
        }
        if (isGlued(token, previous)) {
            return 0;
        }
        return 1;
    }

    /**
     * Spaces between the tokens in the source, or zero when they were on different lines.
     */
    public static int originalGap(Token token, Token previous) {
        if (previous.span().endLine() != token.span().startLine()) {
            return 0;
        }
        return Math.max(0, token.span().startColumn() - previous.span().endColumn());
    }

    private static boolean isGlued(Token token, Token previous) {
        return previous.span().endLine() == token.span().startLine()
                && previous.span().endColumn() == token.span().startColumn();
    }
}
