package com.specharvest.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ListCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void list_renderers_showsAllFormats() {
        int exitCode = execute("list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("(ID: xml)")
            .contains("(ID: json)")
            .contains("(ID: markdown)")
            .contains("File Extension: .md");
    }

    @Test
    void list_writers_showsConsoleAndFilesystem() {
        assertThat(execute("list", "writers")).isZero();
        assertThat(stdout()).contains("• console").contains("• filesystem");
    }

    @Test
    void list_specifications_usesConfiguration() throws IOException {
        Path config = Files.writeString(tempDir.resolve("spec-harvest.yaml"), """
            specifications:
              "33.512": AMF
            """);

        int exitCode = execute("list", "specifications", "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("TS 33.512 (folder: TS 33.512 - AMF)").doesNotContain("33.117");
    }

    @Test
    void list_specificationsWithoutConfig_showsDefaults() {
        int exitCode = execute("list", "specs", "-c", tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("TS 33.117 (folder: TS 33.117 - General Requirements)");
    }

    @Test
    void list_unknownType_fails() {
        assertThat(execute("list", "scanners")).isEqualTo(1);
    }
}
