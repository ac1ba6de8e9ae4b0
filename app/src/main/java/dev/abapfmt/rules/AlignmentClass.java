package dev.abapfmt.rules;

import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classification of positioned tokens used to decide which tokens may form one alignment column.
 */
enum AlignmentClass {
    COLON,
    COMMA,
    PERIOD,
    ASSIGNMENT_OP,
    COMPARISON_OP,
    COMMENT,
    PRAGMA,
    LITERAL,
    IDENTIFIER;

    static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", ":=", "+=", "-=", "*=", "/=", "&&=", "?=");
    static final Set<String> COMPARISON_OPERATORS = Set.of("=", "==", "<>", "!=", "<", "<=", ">", ">=");

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("[+-]?(?:\\d+|'[\\d.]+')(?:\\.\\d+)?");

    static AlignmentClass of(Token token) {
        if (token.role() == TokenRole.COLON) {
            return COLON;
        }
        if (token.role() == TokenRole.PUNCTUATION && token.isComma()) {
            return COMMA;
        }
        if (token.role() == TokenRole.PUNCTUATION && token.isPeriod()) {
            return PERIOD;
        }
        if (isAssignmentOperator(token)) {
            return ASSIGNMENT_OP;
        }
        if (isComparisonOperator(token)) {
            return COMPARISON_OP;
        }
        if (token.role() == TokenRole.COMMENT) {
            return COMMENT;
        }
        if (token.role() == TokenRole.PRAGMA) {
            return PRAGMA;
        }
        if (token.role() == TokenRole.STRING || isNumericLiteral(token)) {
            return LITERAL;
        }
        return IDENTIFIER;
    }

    static boolean isAssignmentOperator(Token token) {
        return token.role() == TokenRole.WORD && ASSIGNMENT_OPERATORS.contains(token.text());
    }

    static boolean isComparisonOperator(Token token) {
        return token.role() == TokenRole.WORD && COMPARISON_OPERATORS.contains(token.text());
    }

    static boolean isNumericLiteral(Token token) {
        return NUMERIC_LITERAL.matcher(token.text()).matches();
    }

    /**
     * Offset of the character numeric literals align on: the digit before the decimal point, else the last digit.
     */
    static int numericAlignmentIndex(String text) {
        int dot = text.indexOf('.');
        if (dot >= 0) {
            return Math.max(0, dot - 1);
        }
        for (int index = text.length() - 1; index >= 0; index--) {
            char value = text.charAt(index);
            if (value != '-' && value != '\'') {
                return index;
            }
        }
        return text.length();
    }

    /**
     * Separators, operators, comments and pragmas only align with their own class; identifiers and literals align
     * with each other.
     */
    boolean isCompatibleWith(AlignmentClass other) {
        if (isStrict() || other.isStrict()) {
            return this == other;
        }
        return true;
    }

    boolean isSeparator() {
        return this == COLON || this == COMMA || this == PERIOD;
    }

    private boolean isStrict() {
        return this != LITERAL && this != IDENTIFIER;
    }
}
