package dev.abapfmt.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A logical statement: its tokens, kind, position and comments, plus the chain it represents if any.
 *
 * <p>A statement without tokens and without chain is a comment-only statement whose comment is the trailing comment.
 */
public final class Statement {

    /** Indent level meaning "keep the original start column". */
    public static final int KEEP_ORIGINAL_COLUMN = -1;

    private static final int UNASSIGNED = Integer.MIN_VALUE;

    private final StatementKind kind;
    private final List<Token> tokens;
    private final List<Token> pragmas;
    private final SourceSpan span;
    private final String raw;
    private final Chain chain;
    private final int sourceIndex;
    private Comment trailingComment;
    private int indentLevel = UNASSIGNED;

    private Statement(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.tokens = List.copyOf(builder.tokens);
        this.pragmas = List.copyOf(builder.pragmas);
        this.span = Objects.requireNonNull(builder.span, "span");
        this.raw = builder.raw == null ? "" : builder.raw;
        this.chain = builder.chain;
        this.sourceIndex = builder.sourceIndex;
        this.trailingComment = builder.trailingComment;
    }

    public static Builder builder(StatementKind kind, SourceSpan span) {
        return new Builder(kind, span);
    }

    /**
     * Statement holding nothing but a comment.
     */
    public static Statement commentOnly(Comment comment, int sourceIndex) {
        return builder(StatementKind.COMMENT, comment.span())
                .raw(comment.value())
                .trailingComment(comment)
                .sourceIndex(sourceIndex)
                .build();
    }

    public StatementKind kind() {
        return kind;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<Token> pragmas() {
        return pragmas;
    }

    public SourceSpan span() {
        return span;
    }

    public String raw() {
        return raw;
    }

    public Optional<Chain> chain() {
        return Optional.ofNullable(chain);
    }

    public boolean isChain() {
        return chain != null;
    }

    public boolean isCommentOnly() {
        return chain == null && tokens.isEmpty();
    }

    /**
     * Index of the first raw statement this statement was built from.
     */
    public int sourceIndex() {
        return sourceIndex;
    }

    /**
     * For chains this is the trailing comment of the last member.
     */
    public Optional<Comment> trailingComment() {
        if (chain != null) {
            return chain.lastMember().flatMap(ChainEntry::trailingComment);
        }
        return Optional.ofNullable(trailingComment);
    }

    public void setTrailingComment(Comment comment) {
        if (chain != null) {
            chain.lastMember()
                    .orElseThrow(() -> new InternalConsistencyException("Chain without members", span))
                    .setTrailingComment(comment);
            return;
        }
        this.trailingComment = comment;
    }

    public boolean hasIndentLevel() {
        return indentLevel != UNASSIGNED;
    }

    public int indentLevel() {
        if (indentLevel == UNASSIGNED) {
            throw new InternalConsistencyException("Indent level read before assignment", span);
        }
        return indentLevel;
    }

    public void assignIndentLevel(int level) {
        if (indentLevel != UNASSIGNED) {
            throw new InternalConsistencyException("Indent level assigned twice", span);
        }
        if (level < KEEP_ORIGINAL_COLUMN) {
            throw new IllegalArgumentException("Invalid indent level " + level);
        }
        this.indentLevel = level;
    }

    @Override
    public String toString() {
        return kind + "[" + span.describe() + "] " + raw;
    }

    public static final class Builder {
        private final StatementKind kind;
        private final SourceSpan span;
        private List<Token> tokens = List.of();
        private List<Token> pragmas = List.of();
        private String raw;
        private Chain chain;
        private int sourceIndex;
        private Comment trailingComment;

        private Builder(StatementKind kind, SourceSpan span) {
            this.kind = kind;
            this.span = span;
        }

        public Builder tokens(List<Token> value) {
            this.tokens = value;
            return this;
        }

        public Builder pragmas(List<Token> value) {
            this.pragmas = value;
            return this;
        }

        public Builder raw(String value) {
            this.raw = value;
            return this;
        }

        public Builder chain(Chain value) {
            this.chain = value;
            return this;
        }

        public Builder sourceIndex(int value) {
            this.sourceIndex = value;
            return this;
        }

        public Builder trailingComment(Comment value) {
            this.trailingComment = value;
            return this;
        }

        public Statement build() {
            return new Statement(this);
        }
    }
}
