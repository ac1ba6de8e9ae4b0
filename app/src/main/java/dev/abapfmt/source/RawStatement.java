package dev.abapfmt.source;

import dev.abapfmt.model.SourceSpan;
import dev.abapfmt.model.StatementKind;
import dev.abapfmt.model.Token;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One statement as delivered by the tokenizer: either code up to a period or chain comma, or a single comment.
 *
 * <p>Chain members repeat the keyword prefix in {@link #tokens()} and expose the shared colon through {@link #colon()};
 * the colon itself is never part of the token list. Pragmas are reported separately from the tokens.
 */
public interface RawStatement {

    RawStatementType type();

    StatementKind kind();

    List<Token> tokens();

    /**
     * The chain colon, or {@code null} when the statement is not a chain member.
     */
    Token colon();

    List<Token> pragmas();

    /**
     * Synthetic statements have no trustworthy source position and keep their original column.
     */
    boolean isSynthetic();

    default boolean isComment() {
        return type() == RawStatementType.COMMENT;
    }

    default boolean isChainMember() {
        return colon() != null;
    }

    /**
     * Span from the first to the last positioned fragment, colon and pragmas included.
     */
    default SourceSpan span() {
        List<Token> all = new ArrayList<>(tokens());
        all.addAll(pragmas());
        if (colon() != null) {
            all.add(colon());
        }
        if (all.isEmpty()) {
            return SourceSpan.NONE;
        }
        Token first = all.stream().min(Comparator.comparingInt(token -> token.span().startOffset())).orElseThrow();
        Token last = all.stream().max(Comparator.comparingInt(token -> token.span().endOffset())).orElseThrow();
        return SourceSpan.covering(first.span(), last.span());
    }
}
