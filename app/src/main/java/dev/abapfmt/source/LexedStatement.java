package dev.abapfmt.source;

import dev.abapfmt.model.StatementKind;
import dev.abapfmt.model.Token;
import java.util.List;
import java.util.Objects;

/**
 * Immutable {@link RawStatement} produced by {@link AbapStatementReader}.
 */
public record LexedStatement(RawStatementType type,
                             StatementKind kind,
                             List<Token> tokens,
                             Token colon,
                             List<Token> pragmas,
                             boolean isSynthetic) implements RawStatement {

    public LexedStatement {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        pragmas = pragmas == null ? List.of() : List.copyOf(pragmas);
    }

    public static LexedStatement comment(Token comment) {
        return new LexedStatement(RawStatementType.COMMENT, StatementKind.COMMENT, List.of(comment), null, List.of(),
                false);
    }

    public static LexedStatement code(StatementKind kind, List<Token> tokens, Token colon, List<Token> pragmas) {
        return new LexedStatement(RawStatementType.STATEMENT, kind, tokens, colon, pragmas, false);
    }
}
