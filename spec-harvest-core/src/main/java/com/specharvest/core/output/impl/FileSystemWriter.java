package com.specharvest.core.output.impl;

import com.specharvest.core.output.OutputBundle;
import com.specharvest.core.output.OutputContext;
import com.specharvest.core.output.OutputFile;
import com.specharvest.core.output.OutputWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered files below an output directory as UTF-8.
 *
 * <p>Parent directories are created as needed and existing files are overwritten, so
 * re-running an extraction replaces the previous output next to each source document.
 * Relative paths that would escape the output directory are rejected.
 */
public class FileSystemWriter implements OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWriter.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(OutputBundle bundle, OutputContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.debug("Writing {} files below {}", bundle.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (OutputFile file : bundle.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, OutputFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside output directory: " + file.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.info("Wrote {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
