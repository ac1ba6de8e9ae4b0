package dev.abapfmt.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a colon chain: either a member token sequence or an interleaved standalone comment.
 */
public final class ChainEntry {

    public enum Type {
        MEMBER,
        COMMENT
    }

    private final Type type;
    private final List<Token> tokens;
    private final Comment comment;
    private Comment trailingComment;

    private ChainEntry(Type type, List<Token> tokens, Comment comment) {
        this.type = type;
        this.tokens = tokens;
        this.comment = comment;
    }

    public static ChainEntry member(List<Token> tokens) {
        return new ChainEntry(Type.MEMBER, List.copyOf(Objects.requireNonNull(tokens, "tokens")), null);
    }

    public static ChainEntry comment(Comment comment) {
        return new ChainEntry(Type.COMMENT, List.of(), Objects.requireNonNull(comment, "comment"));
    }

    public Type type() {
        return type;
    }

    public boolean isMember() {
        return type == Type.MEMBER;
    }

    /**
     * Member tokens; shared with the owning statement's token list.
     */
    public List<Token> tokens() {
        return tokens;
    }

    public Optional<Comment> comment() {
        return Optional.ofNullable(comment);
    }

    public Optional<Comment> trailingComment() {
        return Optional.ofNullable(trailingComment);
    }

    public void setTrailingComment(Comment trailingComment) {
        if (type != Type.MEMBER) {
            throw new IllegalStateException("Only chain members carry trailing comments");
        }
        this.trailingComment = trailingComment;
    }

    public int startLine() {
        if (type == Type.COMMENT) {
            return comment.line();
        }
        return tokens.isEmpty() ? Integer.MAX_VALUE : tokens.get(0).line();
    }
}
