package dev.abapfmt.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatementTest {

    @Test
    void commentOnlyStatementCarriesCommentAsTrailingComment() {
        Comment comment = new Comment("\" note", false, new SourceSpan(0, 6, 3, 0, 3, 6));

        Statement statement = Statement.commentOnly(comment, 4);

        assertThat(statement.isCommentOnly()).isTrue();
        assertThat(statement.kind()).isEqualTo(StatementKind.COMMENT);
        assertThat(statement.trailingComment()).contains(comment);
        assertThat(statement.span().startLine()).isEqualTo(3);
        assertThat(statement.sourceIndex()).isEqualTo(4);
    }

    @Test
    void chainDelegatesTrailingCommentToLastMember() {
        Token keyword = token("DATA", 0);
        ChainEntry first = ChainEntry.member(List.of(token("lv_a", 6)));
        ChainEntry last = ChainEntry.member(List.of(token("lv_b", 12)));
        Chain chain = new Chain(List.of(keyword), List.of(first, last));
        Statement statement = Statement.builder(StatementKind.OTHER, keyword.span()).chain(chain).build();
        Comment comment = new Comment("\" last", true, new SourceSpan(20, 26, 1, 20, 1, 26));

        statement.setTrailingComment(comment);

        assertThat(last.trailingComment()).contains(comment);
        assertThat(first.trailingComment()).isEmpty();
        assertThat(statement.trailingComment()).contains(comment);
    }

    @Test
    void indentLevelIsAssignedOnce() {
        Statement statement = Statement.builder(StatementKind.OTHER, SourceSpan.NONE).tokens(List.of(token("x", 0)))
                .build();

        assertThat(statement.hasIndentLevel()).isFalse();
        assertThatThrownBy(statement::indentLevel).isInstanceOf(InternalConsistencyException.class);

        statement.assignIndentLevel(2);

        assertThat(statement.indentLevel()).isEqualTo(2);
        assertThatThrownBy(() -> statement.assignIndentLevel(3))
                .isInstanceOf(InternalConsistencyException.class)
                .satisfies(error -> assertThat(((InternalConsistencyException) error).span()).isEqualTo(SourceSpan.NONE));
    }

    @Test
    void recognisesPseudoComments() {
        SourceSpan span = new SourceSpan(0, 11, 1, 0, 1, 11);

        assertThat(new Comment("\"#EC NEEDED", true, span).isPseudo()).isTrue();
        assertThat(new Comment("\" #EC", true, span).isPseudo()).isFalse();
        assertThat(new Comment("\"  text  ", true, span).body()).isEqualTo("text");
    }

    private static Token token(String text, int column) {
        return new Token(TokenRole.WORD, text,
                new SourceSpan(column, column + text.length(), 1, column, 1, column + text.length()));
    }
}
