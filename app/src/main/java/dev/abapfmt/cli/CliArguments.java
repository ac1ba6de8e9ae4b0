package dev.abapfmt.cli;

import dev.abapfmt.config.ChainFormatting;
import dev.abapfmt.config.KeywordCase;
import dev.abapfmt.config.LogFormat;
import dev.abapfmt.config.RunMode;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/**
 * Command-line options. Options left unset are {@code null} so that environment values can fill them in.
 */
@CommandLine.Command(name = "abap-formatter", mixinStandardHelpOptions = true, version = "abap-formatter 0.1.0",
        description = "Deterministic formatter for ABAP source files")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = RunModeConverter.class,
            description = "What to do with the result: stdout, write or check")
    private RunMode mode;

    @CommandLine.Option(names = {"-w", "--write"}, description = "Shortcut for --mode write")
    private boolean write;

    @CommandLine.Option(names = {"-c", "--check"}, description = "Shortcut for --mode check")
    private boolean check;

    @CommandLine.Option(names = "--keyword-case", converter = KeywordCaseConverter.class,
            description = "Keyword case: upper or lower", paramLabel = "CASE")
    private KeywordCase keywordCase;

    @CommandLine.Option(names = "--space-before-period", arity = "0..1", fallbackValue = "true",
            description = "Keep one space before periods and chain commas", paramLabel = "BOOL")
    private Boolean spaceBeforePeriod;

    @CommandLine.Option(names = "--space-before-comment-sign", arity = "0..1", fallbackValue = "true",
            description = "Keep one space before an inline comment sign", paramLabel = "BOOL")
    private Boolean spaceBeforeCommentSign;

    @CommandLine.Option(names = "--space-after-comment-sign", arity = "0..1", fallbackValue = "true",
            description = "Insert a space after the comment sign", paramLabel = "BOOL")
    private Boolean spaceAfterCommentSign;

    @CommandLine.Option(names = "--chain-formatting", converter = ChainFormattingConverter.class,
            description = "Chain layout: preserve or expand (expand behaves like preserve)", paramLabel = "STYLE")
    private ChainFormatting chainFormatting;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per block level", paramLabel = "COUNT")
    private Integer indentWidth;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class,
            description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug details")
    private boolean verbose;

    @CommandLine.Parameters(paramLabel = "FILE", arity = "0..*",
            description = "ABAP source files; none or '-' reads standard input")
    private List<String> files = new ArrayList<>();

    public RunMode mode() {
        if (mode != null) {
            return mode;
        }
        if (write) {
            return RunMode.WRITE;
        }
        return check ? RunMode.CHECK : null;
    }

    public KeywordCase keywordCase() {
        return keywordCase;
    }

    public Boolean spaceBeforePeriod() {
        return spaceBeforePeriod;
    }

    public Boolean spaceBeforeCommentSign() {
        return spaceBeforeCommentSign;
    }

    public Boolean spaceAfterCommentSign() {
        return spaceAfterCommentSign;
    }

    public ChainFormatting chainFormatting() {
        return chainFormatting;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public List<String> files() {
        return files;
    }
}
