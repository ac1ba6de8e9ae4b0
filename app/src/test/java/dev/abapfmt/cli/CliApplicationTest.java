package dev.abapfmt.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.abapfmt.config.ConfigLoader;
import dev.abapfmt.writer.DocumentWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String UNFORMATTED = "IF lv_a = 1.\nlv_b = 2.\nENDIF.\n";
    private static final String FORMATTED = "IF lv_a = 1.\n  lv_b = 2.\nENDIF.\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void formatsStandardInputToStandardOutput() {
        int exitCode = application(UNFORMATTED, Map.of()).run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(FORMATTED);
    }

    @Test
    void printsFormattedFilesInStdoutMode() throws Exception {
        Path source = write("zfirst.prog.abap", UNFORMATTED);

        int exitCode = application("", Map.of()).run(new String[] {"--keyword-case", "lower", source.toString()});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("if lv_a = 1.\n  lv_b = 2.\nendif.\n");
        assertThat(Files.readString(source)).isEqualTo(UNFORMATTED);
    }

    @Test
    void rewritesFilesInWriteMode() throws Exception {
        Path source = write("zfirst.prog.abap", UNFORMATTED);
        Path clean = write("zsecond.prog.abap", FORMATTED);

        int exitCode = application("", Map.of()).run(new String[] {"--write", source.toString(), clean.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(source)).isEqualTo(FORMATTED);
        assertThat(Files.readString(clean)).isEqualTo(FORMATTED);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void checkModeReportsFilesThatWouldChange() throws Exception {
        Path source = write("zfirst.prog.abap", UNFORMATTED);
        Path clean = write("zsecond.prog.abap", FORMATTED);

        int dirty = application("", Map.of()).run(new String[] {"--check", source.toString(), clean.toString()});
        int tidy = application("", Map.of()).run(new String[] {"--mode", "check", clean.toString()});

        assertThat(dirty).isEqualTo(CliApplication.EXIT_WOULD_CHANGE);
        assertThat(tidy).isZero();
        assertThat(Files.readString(source)).isEqualTo(UNFORMATTED);
    }

    @Test
    void readsModeFromEnvironment() throws Exception {
        Path source = write("zfirst.prog.abap", UNFORMATTED);

        int exitCode = application("", Map.of("ABAP_FORMAT_MODE", "write")).run(new String[] {source.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(source)).isEqualTo(FORMATTED);
    }

    @Test
    void missingFileEndsWithIoFailure() {
        int exitCode = application("", Map.of())
                .run(new String[] {tempDir.resolve("missing.prog.abap").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void invalidOptionsEndWithUsageError() {
        assertThat(application("", Map.of()).run(new String[] {"--keyword-case", "shout"})).isEqualTo(2);
        assertThat(application("", Map.of()).run(new String[] {"--mode", "write"})).isEqualTo(2);
        assertThat(application("", Map.of()).run(new String[] {"--indent-width", "0"})).isEqualTo(2);
    }

    @Test
    void helpExitsSuccessfully() {
        assertThat(application("", Map.of()).run(new String[] {"--help"})).isZero();
    }

    private CliApplication application(String stdin, Map<String, String> environment) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(environment.get(key))),
                new DocumentWriter(),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
