package dev.abapfmt.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.abapfmt.format.FormatResult;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void writesFormattedTextAndCreatesDirectories() throws Exception {
        Path target = tempDir.resolve("src/zdemo.prog.abap");

        boolean written = writer.write(target, FormatResult.formatted("zdemo.prog.abap", "WRITE 'ä'.\n"));

        assertThat(written).isTrue();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("WRITE 'ä'.\n");
    }

    @Test
    void leavesUnchangedFilesAlone() throws Exception {
        Path target = tempDir.resolve("zdemo.prog.abap");
        Files.writeString(target, "lv_a = 1.\n", StandardCharsets.UTF_8);
        var before = Files.getLastModifiedTime(target);

        boolean written = writer.write(target, FormatResult.formatted("zdemo.prog.abap", "lv_a = 1.\n"));

        assertThat(written).isFalse();
        assertThat(Files.getLastModifiedTime(target)).isEqualTo(before);
    }

    @Test
    void readingMissingFileFails() {
        assertThatThrownBy(() -> writer.read(tempDir.resolve("missing.prog.abap")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.prog.abap");
    }
}
