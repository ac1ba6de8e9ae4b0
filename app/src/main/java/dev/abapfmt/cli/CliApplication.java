package dev.abapfmt.cli;

import dev.abapfmt.config.Config;
import dev.abapfmt.config.ConfigLoader;
import dev.abapfmt.config.RunMode;
import dev.abapfmt.config.SystemEnvironmentReader;
import dev.abapfmt.format.AbapFormatter;
import dev.abapfmt.format.FormatResult;
import dev.abapfmt.logging.LoggingConfigurator;
import dev.abapfmt.model.InternalConsistencyException;
import dev.abapfmt.writer.DocumentWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and formatter.
 */
public final class CliApplication {

    static final int EXIT_WOULD_CHANGE = 1;
    static final int EXIT_IO_FAILURE = 3;
    static final int EXIT_INTERNAL_ERROR = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String STDIN_NAME = "<stdin>";

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;
    private final InputStream stdin;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentWriter(), System.in,
                new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter, InputStream stdin, PrintStream stdout) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.debug("Running in {} mode with {}", config.mode(), config.formatOptions());

        AbapFormatter formatter = new AbapFormatter(config.formatOptions());
        try {
            return config.readsStandardInput()
                    ? formatStandardInput(formatter, config)
                    : formatFiles(formatter, config);
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex.getCause());
            return EXIT_IO_FAILURE;
        } catch (InternalConsistencyException ex) {
            LOGGER.error("Internal formatter error at {}: {}", ex.span().describe(), ex.getMessage(), ex);
            return EXIT_INTERNAL_ERROR;
        }
    }

    private int formatStandardInput(AbapFormatter formatter, Config config) {
        String source;
        try {
            source = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read standard input", ex);
        }
        FormatResult result = formatter.format(STDIN_NAME, source);
        if (config.mode().isCheck()) {
            if (result.differsFrom(source)) {
                LOGGER.info("{} would be reformatted", STDIN_NAME);
                return EXIT_WOULD_CHANGE;
            }
            return 0;
        }
        stdout.print(result.text());
        stdout.flush();
        return 0;
    }

    private int formatFiles(AbapFormatter formatter, Config config) {
        int changed = 0;
        int passedThrough = 0;
        for (Path file : config.files()) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("file", file.toString())) {
                String source = documentWriter.read(file);
                FormatResult result = formatter.format(file.getFileName().toString(), source);
                if (!result.formatted()) {
                    passedThrough++;
                }
                switch (config.mode()) {
                    case STDOUT -> stdout.print(result.text());
                    case WRITE -> {
                        if (documentWriter.write(file, result)) {
                            changed++;
                            LOGGER.info("Reformatted {}", file);
                        }
                    }
                    case CHECK -> {
                        if (result.differsFrom(source)) {
                            changed++;
                            LOGGER.info("{} would be reformatted", file);
                        }
                    }
                }
            }
        }
        stdout.flush();
        if (config.mode() != RunMode.STDOUT) {
            LOGGER.info("Processed {} file(s): {} changed, {} left unformatted", config.files().size(), changed,
                    passedThrough);
        }
        return config.mode().isCheck() && changed > 0 ? EXIT_WOULD_CHANGE : 0;
    }
}
