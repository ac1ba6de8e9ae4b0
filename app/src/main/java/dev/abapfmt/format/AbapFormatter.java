package dev.abapfmt.format;

import dev.abapfmt.build.StatementBuilder;
import dev.abapfmt.config.ChainFormatting;
import dev.abapfmt.config.FormatOptions;
import dev.abapfmt.indent.IndentationEngine;
import dev.abapfmt.model.Program;
import dev.abapfmt.model.Statement;
import dev.abapfmt.render.DocumentAssembler;
import dev.abapfmt.render.LineRenderer;
import dev.abapfmt.rules.AbapKeywords;
import dev.abapfmt.rules.AlignmentCompressor;
import dev.abapfmt.rules.ClosingBracketRepositioner;
import dev.abapfmt.rules.CommentNormalizer;
import dev.abapfmt.rules.FormattingContext;
import dev.abapfmt.rules.TrailingCommentMerger;
import dev.abapfmt.source.AbapStatementReader;
import dev.abapfmt.source.RawStatement;
import dev.abapfmt.source.StatementReader;
import dev.abapfmt.source.UpstreamObjectMissingException;
import dev.abapfmt.source.UpstreamParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats one ABAP document: build statements, indent, reposition closing brackets, merge comments, compress stale
 * alignment and render.
 *
 * <p>Documents the reader cannot split, or that contain nothing formattable, are passed through with trailing
 * whitespace removed. Each call works on its own side tables, so one instance may format documents concurrently.
 */
public class AbapFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbapFormatter.class);

    private final StatementReader reader;
    private final StatementBuilder builder = new StatementBuilder();
    private final IndentationEngine indentation = new IndentationEngine();
    private final ClosingBracketRepositioner repositioner = new ClosingBracketRepositioner();
    private final TrailingCommentMerger commentMerger = new TrailingCommentMerger();
    private final AlignmentCompressor compressor = new AlignmentCompressor();
    private final DocumentAssembler assembler;

    public AbapFormatter(FormatOptions options) {
        this(new AbapStatementReader(), options, AbapKeywords.load());
    }

    public AbapFormatter(StatementReader reader, FormatOptions options, AbapKeywords keywords) {
        this.reader = Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(options, "options");
        this.assembler = new DocumentAssembler(new LineRenderer(options, keywords), new CommentNormalizer(options));
        if (options.chainFormatting() == ChainFormatting.EXPAND) {
            LOGGER.warn("Chain formatting 'expand' is not supported; chains keep their layout");
        }
    }

    public FormatResult format(String fileName, String source) {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(source, "source");
        String text = source.replace("\r\n", "\n");
        List<RawStatement> rawStatements;
        try {
            rawStatements = reader.read(fileName, text);
            if (rawStatements.isEmpty()) {
                throw new UpstreamObjectMissingException("No statements found in " + fileName);
            }
        } catch (UpstreamParseException | UpstreamObjectMissingException ex) {
            LOGGER.warn("Leaving {} unformatted: {}", fileName, ex.getMessage());
            return FormatResult.passedThrough(fileName, passThrough(text), ex.getMessage());
        }
        String formatted = formatStatements(fileName, rawStatements);
        LOGGER.debug("Formatted {} ({} raw statements)", fileName, rawStatements.size());
        return FormatResult.formatted(fileName, formatted);
    }

    /**
     * Runs the layout pipeline on an already tokenized document.
     */
    public String formatStatements(String fileName, List<RawStatement> rawStatements) {
        Program program = builder.build(fileName, rawStatements);
        indentation.indent(program, rawStatements);
        List<Statement> statements = program.statements();
        FormattingContext context = new FormattingContext();
        repositioner.apply(statements, context);
        commentMerger.apply(statements, context);
        compressor.apply(statements, context);
        return assembler.assemble(program, context);
    }

    static String passThrough(String text) {
        return Arrays.stream(text.split("\n", -1))
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"));
    }
}
