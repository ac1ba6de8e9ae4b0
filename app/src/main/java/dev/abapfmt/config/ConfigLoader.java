package dev.abapfmt.config;

import dev.abapfmt.cli.CliArguments;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_KEYWORD_CASE = "ABAP_KEYWORD_CASE";
    static final String ENV_SPACE_BEFORE_PERIOD = "ABAP_SPACE_BEFORE_PERIOD";
    static final String ENV_SPACE_BEFORE_COMMENT_SIGN = "ABAP_SPACE_BEFORE_COMMENT_SIGN";
    static final String ENV_SPACE_AFTER_COMMENT_SIGN = "ABAP_SPACE_AFTER_COMMENT_SIGN";
    static final String ENV_CHAIN_FORMATTING = "ABAP_CHAIN_FORMATTING";
    static final String ENV_INDENT_WIDTH = "ABAP_INDENT_WIDTH";
    static final String ENV_MODE = "ABAP_FORMAT_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String STDIN_MARKER = "-";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        FormatOptions defaults = FormatOptions.defaults();

        KeywordCase keywordCase = arguments.keywordCase() != null
                ? arguments.keywordCase()
                : environmentReader.get(ENV_KEYWORD_CASE)
                        .filter(ConfigLoader::isNotBlank)
                        .map(KeywordCase::from)
                        .orElse(defaults.keywordCase());
        ChainFormatting chainFormatting = arguments.chainFormatting() != null
                ? arguments.chainFormatting()
                : environmentReader.get(ENV_CHAIN_FORMATTING)
                        .filter(ConfigLoader::isNotBlank)
                        .map(ChainFormatting::from)
                        .orElse(defaults.chainFormatting());
        boolean spaceBeforePeriod = resolveFlag(arguments.spaceBeforePeriod(), ENV_SPACE_BEFORE_PERIOD,
                defaults.spaceBeforePeriod());
        boolean spaceBeforeCommentSign = resolveFlag(arguments.spaceBeforeCommentSign(),
                ENV_SPACE_BEFORE_COMMENT_SIGN, defaults.spaceBeforeCommentSign());
        boolean spaceAfterCommentSign = resolveFlag(arguments.spaceAfterCommentSign(), ENV_SPACE_AFTER_COMMENT_SIGN,
                defaults.spaceAfterCommentSign());
        int indentWidth = resolveIndentWidth(arguments, defaults.indentWidth());

        FormatOptions formatOptions = new FormatOptions(keywordCase, spaceBeforePeriod, spaceBeforeCommentSign,
                spaceAfterCommentSign, chainFormatting, indentWidth);
        return new Config(resolveMode(arguments), resolveLogFormat(arguments), formatOptions,
                resolveFiles(arguments.files()));
    }

    private RunMode resolveMode(CliArguments arguments) {
        RunMode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(RunMode::from)
                .orElse(RunMode.STDOUT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(Boolean cliValue, String envKey, boolean defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseBoolean(envKey, value))
                .orElse(defaultValue);
    }

    private int resolveIndentWidth(CliArguments arguments, int defaultValue) {
        Integer cliValue = arguments.indentWidth();
        if (cliValue != null) {
            if (cliValue <= 0) {
                throw new IllegalArgumentException("--indent-width must be greater than zero");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_INDENT_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(defaultValue);
    }

    private static List<Path> resolveFiles(List<String> files) {
        if (files == null) {
            return List.of();
        }
        return files.stream()
                .filter(ConfigLoader::isNotBlank)
                .filter(value -> !STDIN_MARKER.equals(value))
                .map(Path::of)
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String key, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false");
        };
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
