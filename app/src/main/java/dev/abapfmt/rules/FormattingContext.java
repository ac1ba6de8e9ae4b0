package dev.abapfmt.rules;

import dev.abapfmt.model.Comment;
import dev.abapfmt.model.Statement;
import dev.abapfmt.model.Token;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Side tables of one formatting run, keyed by token and statement identity.
 */
public final class FormattingContext {

    private final Map<Token, Integer> spaceOverrides = new IdentityHashMap<>();
    private final Set<Statement> touched = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Statement, Comment> postComments = new IdentityHashMap<>();

    public void overrideSpaces(Token token, int spaces) {
        if (spaces < 0) {
            throw new IllegalArgumentException("Space override must not be negative");
        }
        spaceOverrides.put(token, spaces);
    }

    public boolean hasOverride(Token token) {
        return spaceOverrides.containsKey(token);
    }

    public OptionalInt spaceOverride(Token token) {
        Integer value = spaceOverrides.get(token);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public void markTouched(Statement statement) {
        touched.add(statement);
    }

    /**
     * A statement is touched once a closing bracket or period of it moved up a line.
     */
    public boolean isTouched(Statement statement) {
        return touched.contains(statement);
    }

    public void setPostComment(Statement statement, Comment comment) {
        postComments.put(statement, comment);
    }

    public Optional<Comment> postComment(Statement statement) {
        return Optional.ofNullable(postComments.get(statement));
    }
}
