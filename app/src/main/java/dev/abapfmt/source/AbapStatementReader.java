package dev.abapfmt.source;

import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical statement splitter for ABAP source. Statements end at a period; colon chains are split into one raw
 * statement per member, each repeating the keyword prefix and sharing the colon token.
 *
 * <p>Comments that appear while a statement is still open are reported before that statement. Comments following a
 * period or chain comma are reported after it.
 */
public class AbapStatementReader implements StatementReader {

    private static final Set<String> UNSUPPORTED_EXTENSIONS = Set.of("ddls", "ddlsrc", "asddls", "dcls", "asdcls",
            "ddlx", "asddlxs", "bdef", "asbdef", "srvd", "srvdsrv");

    @Override
    public List<RawStatement> read(String fileName, String text) {
        if (text == null || text.isBlank()) {
            throw new UpstreamObjectMissingException("No statements found in " + fileName);
        }
        String extension = extensionOf(fileName);
        if (UNSUPPORTED_EXTENSIONS.contains(extension)) {
            throw new UpstreamObjectMissingException("Unsupported object type '" + extension + "' for " + fileName);
        }
        List<Token> tokens = new AbapLexer(text).tokenize();
        return new Splitter().split(tokens);
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static final class Splitter {

        private final List<RawStatement> statements = new ArrayList<>();
        private final List<Token> pendingComments = new ArrayList<>();
        private List<Token> current = new ArrayList<>();
        private List<Token> pragmas = new ArrayList<>();
        private List<Token> prefix = List.of();
        private Token colon;
        private int depth;

        List<RawStatement> split(List<Token> tokens) {
            for (Token token : tokens) {
                switch (token.role()) {
                    case COMMENT -> acceptComment(token);
                    case PRAGMA -> pragmas.add(token);
                    case COLON -> acceptColon(token);
                    default -> acceptCode(token);
                }
            }
            if (hasOpenContent()) {
                emit();
            }
            flushComments();
            return statements;
        }

        private void acceptComment(Token comment) {
            if (hasOpenContent()) {
                pendingComments.add(comment);
            } else {
                statements.add(LexedStatement.comment(comment));
            }
        }

        private void acceptColon(Token token) {
            if (colon == null) {
                colon = token;
                prefix = List.copyOf(current);
            } else {
                current.add(token);
            }
        }

        private void acceptCode(Token token) {
            current.add(token);
            if (token.isOpeningBracket()) {
                depth++;
            } else if (token.isClosingBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (token.isPeriod() && token.role() == TokenRole.PUNCTUATION) {
                emit();
                colon = null;
                prefix = List.of();
                current = new ArrayList<>();
            } else if (token.isComma() && colon != null && depth == 0) {
                emit();
            }
        }

        private boolean hasOpenContent() {
            return current.size() > prefix.size() || !pragmas.isEmpty();
        }

        private void emit() {
            flushComments();
            statements.add(LexedStatement.code(StatementClassifier.classify(current), current, colon, pragmas));
            current = new ArrayList<>(prefix);
            pragmas = new ArrayList<>();
            depth = 0;
        }

        private void flushComments() {
            for (Token comment : pendingComments) {
                statements.add(LexedStatement.comment(comment));
            }
            pendingComments.clear();
        }
    }
}
