package dev.abapfmt.rules;

import dev.abapfmt.model.Comment;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.util.List;
import java.util.Optional;

/**
 * Relocates the inline comment that followed a statement whose closing bracket or period moved up a line.
 *
 * <p>Plain comments are merged into {@code " a; b}. Pseudo comments are never merged: the following comment is kept
 * as a post comment of the moved statement, whose period then goes on its own last line.
 */
public class TrailingCommentMerger {

    public void apply(List<Statement> statements, FormattingContext context) {
        for (int index = 0; index + 1 < statements.size(); index++) {
            Statement current = statements.get(index);
            Statement next = statements.get(index + 1);
            if (!context.isTouched(current)) {
                continue;
            }
            Optional<Comment> nextComment = next.trailingComment();
            if (nextComment.isEmpty() || !nextComment.get().inline()
                    || nextComment.get().line() != current.span().endLine()
                    || !isSignComment(nextComment.get())) {
                continue;
            }
            Optional<Comment> currentComment = current.trailingComment();
            if (nextComment.get().isPseudo() || currentComment.map(Comment::isPseudo).orElse(false)) {
                context.setPostComment(current, nextComment.get());
                forcePeriodLine(current);
                next.setTrailingComment(null);
                continue;
            }
            String merged = currentComment
                    .map(comment -> comment.body() + "; " + nextComment.get().body())
                    .orElse(nextComment.get().body());
            Comment base = currentComment.orElse(nextComment.get());
            current.setTrailingComment(base.withValue(Comment.COMMENT_SIGN + " " + merged));
            next.setTrailingComment(null);
        }
    }

    private static boolean isSignComment(Comment comment) {
        String trimmed = comment.value().stripLeading();
        return !trimmed.isEmpty() && trimmed.charAt(0) == Comment.COMMENT_SIGN;
    }

    private static void forcePeriodLine(Statement statement) {
        List<Token> tokens = statement.tokens();
        for (int index = tokens.size() - 1; index >= 1; index--) {
            Token token = tokens.get(index);
            if (token.role() == TokenRole.PUNCTUATION && token.isPeriod()) {
                tokens.get(index - 1).setFollowingLineBreak(true);
                return;
            }
        }
    }
}
