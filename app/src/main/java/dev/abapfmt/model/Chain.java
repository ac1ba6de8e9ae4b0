package dev.abapfmt.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A colon chain such as {@code DATA: a TYPE i, b TYPE i.} with its keyword prefix and ordered entries.
 */
public final class Chain {

    private final List<Token> keywordTokens;
    private final List<ChainEntry> entries;

    public Chain(List<Token> keywordTokens, List<ChainEntry> entries) {
        Objects.requireNonNull(keywordTokens, "keywordTokens");
        if (keywordTokens.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one keyword token");
        }
        this.keywordTokens = List.copyOf(keywordTokens);
        List<ChainEntry> sorted = new ArrayList<>(Objects.requireNonNull(entries, "entries"));
        sorted.sort(Comparator.comparingInt(ChainEntry::startLine));
        this.entries = List.copyOf(sorted);
    }

    /**
     * The leading keyword, e.g. {@code DATA} for {@code DATA:} or {@code CLASS-DATA} for {@code CLASS-DATA:}.
     */
    public Token keyword() {
        return keywordTokens.get(0);
    }

    /**
     * All tokens in front of the colon.
     */
    public List<Token> keywordTokens() {
        return keywordTokens;
    }

    public List<ChainEntry> entries() {
        return entries;
    }

    public Optional<ChainEntry> lastMember() {
        for (int index = entries.size() - 1; index >= 0; index--) {
            if (entries.get(index).isMember()) {
                return Optional.of(entries.get(index));
            }
        }
        return Optional.empty();
    }
}
