package com.specharvest.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExtractCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void extract_unknownFormat_failsBeforeDownloading() {
        int exitCode = execute("extract", "33.117",
            "-c", tempDir.resolve("missing.yaml").toString(),
            "-w", tempDir.toString(),
            "-f", "pdf");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Unknown output format: pdf");
        assertThat(tempDir.resolve("TS 33.117 - General Requirements")).doesNotExist();
    }

    @Test
    void extract_unreachableArchive_reportsFailedSpecification() throws IOException {
        // Given
        Path config = Files.writeString(tempDir.resolve("spec-harvest.yaml"), """
            archive:
              baseUrl: "http://127.0.0.1:9/archive"
              connectTimeoutSeconds: 1
              listingTimeoutSeconds: 1
            """);

        // When
        int exitCode = execute("extract", "33.117", "-c", config.toString(), "-w", tempDir.toString(), "-t", "1");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout())
            .contains("✗ TS 33.117")
            .contains("0 succeeded, 1 failed");
    }
}
