package dev.abapfmt.source;

import dev.abapfmt.model.SourceSpan;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.ArrayList;
import java.util.List;

/**
 * Character scanner producing classified, positioned tokens. Comments are returned as {@link TokenRole#COMMENT} tokens
 * in stream order; statement boundaries are left to {@link AbapStatementReader}.
 */
final class AbapLexer {

    private static final String WORD_DELIMITERS = "()[],:\"'`|";

    private final String text;
    private int position;
    private int line = 1;
    private int column;

    AbapLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (position < text.length()) {
            char current = text.charAt(position);
            if (Character.isWhitespace(current)) {
                advance();
            } else if (current == '*' && column == 0) {
                tokens.add(readComment());
            } else if (current == '"') {
                tokens.add(readComment());
            } else if (current == '\'' || current == '`') {
                tokens.add(readLiteral(current));
            } else if (current == '|') {
                tokens.add(readTemplate());
            } else if (current == ':') {
                tokens.add(readFixed(TokenRole.COLON, 1));
            } else if (current == '(' || current == ')' || current == '[' || current == ']' || current == ',') {
                tokens.add(readFixed(TokenRole.PUNCTUATION, 1));
            } else if (isTerminatorAt(position)) {
                tokens.add(readFixed(TokenRole.PUNCTUATION, 1));
            } else if (isArrowAt(position)) {
                tokens.add(readFixed(TokenRole.ARROW, 2));
            } else {
                tokens.add(readWord());
            }
        }
        return tokens;
    }

    private Token readComment() {
        int startOffset = position;
        int startLine = line;
        int startColumn = column;
        while (position < text.length() && text.charAt(position) != '\n') {
            advance();
        }
        String value = text.substring(startOffset, position).stripTrailing();
        return new Token(TokenRole.COMMENT, value, new SourceSpan(startOffset, startOffset + value.length(), startLine,
                startColumn, startLine, startColumn + value.length()));
    }

    private Token readLiteral(char quote) {
        int startOffset = position;
        int startLine = line;
        int startColumn = column;
        advance();
        while (true) {
            if (position >= text.length() || text.charAt(position) == '\n') {
                throw new UpstreamParseException("Unterminated literal starting at " + startLine + ":" + startColumn);
            }
            char current = text.charAt(position);
            advance();
            if (current == quote) {
                if (position < text.length() && text.charAt(position) == quote) {
                    advance();
                } else {
                    break;
                }
            }
        }
        return token(TokenRole.STRING, startOffset, startLine, startColumn);
    }

    private Token readTemplate() {
        int startOffset = position;
        int startLine = line;
        int startColumn = column;
        int depth = 0;
        advance();
        while (true) {
            if (position >= text.length() || (depth == 0 && text.charAt(position) == '\n')) {
                throw new UpstreamParseException("Unterminated string template starting at " + startLine + ":"
                        + startColumn);
            }
            char current = text.charAt(position);
            advance();
            if (current == '\\' && position < text.length() && text.charAt(position) != '\n') {
                advance();
            } else if (current == '{') {
                depth++;
            } else if (current == '}') {
                depth = Math.max(0, depth - 1);
            } else if (current == '|' && depth == 0) {
                break;
            }
        }
        return token(TokenRole.STRING, startOffset, startLine, startColumn);
    }

    private Token readFixed(TokenRole role, int length) {
        int startOffset = position;
        int startLine = line;
        int startColumn = column;
        for (int index = 0; index < length; index++) {
            advance();
        }
        return token(role, startOffset, startLine, startColumn);
    }

    private Token readWord() {
        int startOffset = position;
        int startLine = line;
        int startColumn = column;
        while (position < text.length()) {
            char current = text.charAt(position);
            if (Character.isWhitespace(current) || WORD_DELIMITERS.indexOf(current) >= 0) {
                break;
            }
            if (position > startOffset && (isTerminatorAt(position) || isArrowAt(position))) {
                break;
            }
            advance();
        }
        if (position == startOffset) {
            advance();
        }
        String value = text.substring(startOffset, position);
        TokenRole role = value.startsWith("##") && value.length() > 2 ? TokenRole.PRAGMA : TokenRole.WORD;
        return token(role, startOffset, startLine, startColumn);
    }

    private Token token(TokenRole role, int startOffset, int startLine, int startColumn) {
        return new Token(role, text.substring(startOffset, position),
                new SourceSpan(startOffset, position, startLine, startColumn, line, column));
    }

    private boolean isTerminatorAt(int index) {
        if (text.charAt(index) != '.') {
            return false;
        }
        if (index + 1 >= text.length()) {
            return true;
        }
        char next = text.charAt(index + 1);
        return Character.isWhitespace(next) || next == '"';
    }

    private boolean isArrowAt(int index) {
        if (index + 1 >= text.length() || text.charAt(index + 1) != '>') {
            return false;
        }
        char current = text.charAt(index);
        return current == '-' || current == '=';
    }

    private void advance() {
        if (text.charAt(position) == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        position++;
    }
}
