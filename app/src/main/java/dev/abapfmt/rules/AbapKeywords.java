package dev.abapfmt.rules;

import dev.abapfmt.config.KeywordCase;
import dev.abapfmt.model.Token;
import dev.abapfmt.model.TokenRole;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static keyword dictionary deciding which words follow the keyword-case option.
 */
public final class AbapKeywords {

    static final String RESOURCE = "/dev/abapfmt/abap-keywords.txt";

    private final Set<String> keywords;

    AbapKeywords(Set<String> keywords) {
        this.keywords = Set.copyOf(keywords);
    }

    public static AbapKeywords load() {
        try (InputStream stream = AbapKeywords.class.getResourceAsStream(RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Keyword list not found on classpath: " + RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
            Set<String> words = reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .map(line -> line.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            return new AbapKeywords(words);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read keyword list " + RESOURCE, ex);
        }
    }

    public boolean isKeyword(String word) {
        return keywords.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * Text of the token with keyword case applied to keywords and pragmas; other tokens keep their text.
     */
    public String render(Token token, KeywordCase keywordCase) {
        if (token.role() == TokenRole.PRAGMA) {
            return keywordCase.apply(token.text());
        }
        if (token.role() == TokenRole.WORD && keywords.contains(token.upper())) {
            return keywordCase.apply(token.text());
        }
        return token.text();
    }
}
