package dev.abapfmt.model;

/**
 * Lexical role assigned to a token by the tokenizer.
 */
public enum TokenRole {
    WORD,
    PUNCTUATION,
    COMMENT,
    PRAGMA,
    STRING,
    COLON,
    ARROW
}
