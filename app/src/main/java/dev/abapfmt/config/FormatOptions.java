package dev.abapfmt.config;

import java.util.Objects;

/**
 * Layout options of one formatting run.
 */
public record FormatOptions(
        KeywordCase keywordCase,
        boolean spaceBeforePeriod,
        boolean spaceBeforeCommentSign,
        boolean spaceAfterCommentSign,
        ChainFormatting chainFormatting,
        int indentWidth
) {

    public static final int DEFAULT_INDENT_WIDTH = 2;

    public FormatOptions {
        Objects.requireNonNull(keywordCase, "keywordCase");
        Objects.requireNonNull(chainFormatting, "chainFormatting");
        if (indentWidth <= 0) {
            throw new IllegalArgumentException("indentWidth must be greater than zero");
        }
    }

    public static FormatOptions defaults() {
        return new FormatOptions(KeywordCase.UPPER, false, true, true, ChainFormatting.PRESERVE,
                DEFAULT_INDENT_WIDTH);
    }

    public FormatOptions withKeywordCase(KeywordCase value) {
        return new FormatOptions(value, spaceBeforePeriod, spaceBeforeCommentSign, spaceAfterCommentSign,
                chainFormatting, indentWidth);
    }

    public FormatOptions withSpaceBeforePeriod(boolean value) {
        return new FormatOptions(keywordCase, value, spaceBeforeCommentSign, spaceAfterCommentSign, chainFormatting,
                indentWidth);
    }

    public FormatOptions withSpaceBeforeCommentSign(boolean value) {
        return new FormatOptions(keywordCase, spaceBeforePeriod, value, spaceAfterCommentSign, chainFormatting,
                indentWidth);
    }

    public FormatOptions withSpaceAfterCommentSign(boolean value) {
        return new FormatOptions(keywordCase, spaceBeforePeriod, spaceBeforeCommentSign, value, chainFormatting,
                indentWidth);
    }

    public FormatOptions withIndentWidth(int value) {
        return new FormatOptions(keywordCase, spaceBeforePeriod, spaceBeforeCommentSign, spaceAfterCommentSign,
                chainFormatting, value);
    }
}
