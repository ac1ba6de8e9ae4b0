package dev.abapfmt.source;

/**
 * Coarse classification of raw statements delivered by a {@link StatementReader}.
 */
public enum RawStatementType {
    STATEMENT,
    COMMENT
}
