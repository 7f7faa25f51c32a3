package com.specharvest.core.convert;

import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.util.FileUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Converts {@code .doc} files with a local LibreOffice installation in headless mode.
 *
 * <p>The {@code soffice} executable is taken from the first usable candidate: absolute
 * paths are used when they exist, bare names are looked up on {@code PATH}. Without an
 * executable every conversion fails and the originals stay in place.
 *
 * <p>Command run per document:
 * <pre>{@code
 * soffice --headless --convert-to docx --outdir <dir> <file>
 * }</pre>
 */
public class LibreOfficeConverter implements LegacyDocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(LibreOfficeConverter.class);

    private final List<String> executables;
    private final Duration timeout;

    /**
     * Creates a converter from configuration.
     *
     * @param settings converter settings
     * @return configured converter
     */
    public static LibreOfficeConverter from(HarvestConfig.ConverterSettings settings) {
        return new LibreOfficeConverter(settings.executables(), settings.timeout());
    }

    /**
     * Creates a converter.
     *
     * @param executables candidate {@code soffice} locations, in preference order
     * @param timeout maximum time per document
     */
    public LibreOfficeConverter(List<String> executables, Duration timeout) {
        this.executables = List.copyOf(Objects.requireNonNull(executables, "executables must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Locates the {@code soffice} executable.
     *
     * @return the first usable candidate, or empty if LibreOffice is not installed
     */
    public Optional<Path> locateExecutable() {
        for (String candidate : executables) {
            Path path = Paths.get(candidate);
            if (path.isAbsolute()) {
                if (Files.isExecutable(path)) {
                    return Optional.of(path);
                }
            } else {
                Optional<Path> onPath = findOnPath(candidate);
                if (onPath.isPresent()) {
                    return onPath;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> findOnPath(String name) {
        String pathVariable = System.getenv("PATH");
        if (pathVariable == null || pathVariable.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir).resolve(name);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<ConversionResult> convertAll(Path folder) throws IOException {
        List<Path> documents = FileUtils.findByExtension(folder, "doc");
        if (documents.isEmpty()) {
            return List.of();
        }

        Optional<Path> soffice = locateExecutable();
        if (soffice.isEmpty()) {
            log.warn("LibreOffice not found; {} legacy document(s) in {} left unconverted. "
                + "Install with: brew install --cask libreoffice (macOS) or apt-get install libreoffice (Linux)",
                documents.size(), folder);
        }

        List<ConversionResult> results = new ArrayList<>(documents.size());
        for (Path document : documents) {
            results.add(soffice.isPresent()
                ? convertWith(soffice.get(), document)
                : ConversionResult.failed(document, "LibreOffice (soffice) not found"));
        }
        return results;
    }

    @Override
    public ConversionResult convert(Path document) {
        Optional<Path> soffice = locateExecutable();
        if (soffice.isEmpty()) {
            log.warn("LibreOffice not found; cannot convert {}", document.getFileName());
            return ConversionResult.failed(document, "LibreOffice (soffice) not found");
        }
        return convertWith(soffice.get(), document);
    }

    private ConversionResult convertWith(Path soffice, Path document) {
        Path absolute = document.toAbsolutePath();
        Path outDir = absolute.getParent();
        Path target = outDir.resolve(FileUtils.replaceExtension(absolute, "docx"));

        Path processLog = null;
        try {
            processLog = Files.createTempFile("soffice-", ".log");
            Process process = new ProcessBuilder(
                    soffice.toString(),
                    "--headless",
                    "--convert-to", "docx",
                    "--outdir", outDir.toString(),
                    absolute.toString())
                .redirectErrorStream(true)
                .redirectOutput(processLog.toFile())
                .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.error("Conversion of {} timed out after {}s", document.getFileName(), timeout.toSeconds());
                return ConversionResult.failed(document, "Timed out after " + timeout.toSeconds() + "s");
            }

            int exitCode = process.exitValue();
            if (exitCode != 0 || !Files.exists(target)) {
                String output = Files.readString(processLog, StandardCharsets.UTF_8).strip();
                log.error("Failed to convert {} (exit {}): {}", document.getFileName(), exitCode, output);
                return ConversionResult.failed(document, "soffice exited with " + exitCode
                    + (output.isEmpty() ? "" : ": " + output));
            }

            Files.delete(absolute);
            log.info("Converted {} to .docx", document.getFileName());
            return ConversionResult.converted(document, target);
        } catch (IOException e) {
            log.error("Error converting {}: {}", document.getFileName(), e.getMessage());
            return ConversionResult.failed(document, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConversionResult.failed(document, "Interrupted");
        } finally {
            deleteQuietly(processLog);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
