package dev.abapfmt.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A classified, positioned token of a statement.
 *
 * <p>Everything except {@link #hasFollowingLineBreak()} is fixed at construction. The break flag is written by the
 * layout rules that move closing brackets and periods; rendering only reads it.
 */
public final class Token {

    private final TokenRole role;
    private final String text;
    private final String upper;
    private final SourceSpan span;
    private boolean hasFollowingLineBreak;

    public Token(TokenRole role, String text, SourceSpan span) {
        this(role, text, span, false);
    }

    public Token(TokenRole role, String text, SourceSpan span, boolean hasFollowingLineBreak) {
        this.role = Objects.requireNonNull(role, "role");
        this.text = Objects.requireNonNull(text, "text");
        this.span = Objects.requireNonNull(span, "span");
        this.upper = text.toUpperCase(Locale.ROOT);
        this.hasFollowingLineBreak = hasFollowingLineBreak;
    }

    public TokenRole role() {
        return role;
    }

    public String text() {
        return text;
    }

    public String upper() {
        return upper;
    }

    public SourceSpan span() {
        return span;
    }

    public boolean hasFollowingLineBreak() {
        return hasFollowingLineBreak;
    }

    public void setFollowingLineBreak(boolean hasFollowingLineBreak) {
        this.hasFollowingLineBreak = hasFollowingLineBreak;
    }

    /**
     * Fresh token with the same role, text and span, carrying the given break flag.
     */
    public Token copy(boolean lineBreak) {
        return new Token(role, text, span, lineBreak);
    }

    public boolean is(String value) {
        return text.equals(value);
    }

    public boolean isPeriod() {
        return text.equals(".");
    }

    public boolean isComma() {
        return text.equals(",");
    }

    public boolean isOpeningBracket() {
        return text.equals("(") || text.equals("[");
    }

    public boolean isClosingBracket() {
        return text.equals(")") || text.equals("]");
    }

    public int line() {
        return span.startLine();
    }

    @Override
    public String toString() {
        return role + "'" + text + "'@" + span.startLine() + ":" + span.startColumn();
    }
}
