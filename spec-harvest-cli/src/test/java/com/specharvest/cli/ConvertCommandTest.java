package com.specharvest.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ConvertCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void convert_withoutLegacyDocuments_succeeds() {
        int exitCode = execute("convert", tempDir.toString(), "-c", tempDir.resolve("none.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("No .doc documents found");
    }

    @Test
    void convert_withoutLibreOffice_reportsFailure() throws IOException {
        Files.writeString(tempDir.resolve("33117-f00.doc"), "legacy");
        Path config = Files.writeString(tempDir.resolve("spec-harvest.yaml"), """
            converter:
              executables: [/nonexistent/soffice]
            """);

        int exitCode = execute("convert", tempDir.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("✗ 33117-f00.doc: LibreOffice (soffice) not found");
        assertThat(tempDir.resolve("33117-f00.doc")).exists();
    }

    @Test
    void convert_missingFolder_fails() {
        assertThat(execute("convert", tempDir.resolve("missing").toString())).isEqualTo(1);
        assertThat(stderr()).contains("Not a directory");
    }
}
