package dev.abapfmt.model;

/**
 * Position of a source fragment. Lines are 1-based, columns 0-based, and the end column is exclusive.
 */
public record SourceSpan(int startOffset, int endOffset, int startLine, int startColumn, int endLine, int endColumn) {

    public static final SourceSpan NONE = new SourceSpan(0, 0, 1, 0, 1, 0);

    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + ".." + endLine);
        }
        if (startColumn < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Columns must not be negative");
        }
    }

    /**
     * Span reaching from the start of {@code first} to the end of {@code last}.
     */
    public static SourceSpan covering(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.startOffset(), last.endOffset(), first.startLine(), first.startColumn(),
                last.endLine(), last.endColumn());
    }

    /**
     * Smallest span enclosing both spans.
     */
    public SourceSpan union(SourceSpan other) {
        SourceSpan first = other.startOffset() < startOffset ? other : this;
        SourceSpan last = other.endOffset() > endOffset ? other : this;
        return covering(first, last);
    }

    public boolean containsOffset(int offset) {
        return offset >= startOffset && offset < endOffset;
    }

    public String describe() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
