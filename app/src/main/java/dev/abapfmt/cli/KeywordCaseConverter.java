package dev.abapfmt.cli;

import dev.abapfmt.config.KeywordCase;
import picocli.CommandLine;

/**
 * Parses keyword case CLI options.
 */
public class KeywordCaseConverter implements CommandLine.ITypeConverter<KeywordCase> {

    @Override
    public KeywordCase convert(String value) {
        return KeywordCase.from(value);
    }
}
