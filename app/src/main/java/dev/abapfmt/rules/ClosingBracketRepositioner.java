package dev.abapfmt.rules;

import dev.abapfmt.model.ChainEntry;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.List;

/**
 * Moves closing brackets, and periods right behind them, up to the end of the previous line.
 *
 * <p>This is the only writer of {@link Token#hasFollowingLineBreak()} after statement building, apart from the
 * forced period line of {@link TrailingCommentMerger}.
 */
public class ClosingBracketRepositioner {

    public void apply(List<Statement> statements, FormattingContext context) {
        for (Statement statement : statements) {
            boolean changed;
            if (statement.isChain()) {
                changed = false;
                for (ChainEntry entry : statement.chain().orElseThrow().entries()) {
                    changed |= adjust(entry.tokens());
                }
            } else {
                changed = adjust(statement.tokens());
            }
            if (changed) {
                context.markTouched(statement);
            }
        }
    }

    /**
     * Adjusts break flags within one token sequence and reports whether any bracket or period moved.
     */
    boolean adjust(List<Token> tokens) {
        boolean changed = false;
        for (int index = 1; index < tokens.size(); index++) {
            Token previous = tokens.get(index - 1);
            Token current = tokens.get(index);
            if (!previous.hasFollowingLineBreak() || previous.role() == TokenRole.COMMENT) {
                continue;
            }
            boolean moveBracket = current.isClosingBracket();
            boolean movePeriod = isPeriod(current) && previous.isClosingBracket();
            if (!moveBracket && !movePeriod) {
                continue;
            }

            previous.setFollowingLineBreak(false);
            changed = true;

            if (moveBracket && index + 1 < tokens.size()) {
                Token next = tokens.get(index + 1);
                if (next.span().startLine() == current.span().startLine() && !keepsTogether(next)) {
                    current.setFollowingLineBreak(true);
                }
                if (isPeriod(next)) {
                    current.setFollowingLineBreak(false);
                }
            }
        }
        return changed;
    }

    private static boolean keepsTogether(Token next) {
        return isPeriod(next)
                || next.isClosingBracket()
                || next.role() == TokenRole.PRAGMA
                || next.role() == TokenRole.PUNCTUATION;
    }

    private static boolean isPeriod(Token token) {
        return token.role() == TokenRole.PUNCTUATION && token.isPeriod();
    }
}
