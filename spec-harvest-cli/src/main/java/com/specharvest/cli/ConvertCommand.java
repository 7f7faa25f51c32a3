package com.specharvest.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.specharvest.core.config.ConfigLoader;
import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.convert.ConversionResult;
import com.specharvest.core.convert.LibreOfficeConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to convert legacy .doc documents below a folder to .docx.
 *
 * <p>Requires a LibreOffice installation; candidate executables come from the
 * {@code converter} section of the configuration.
 */
@Command(
    name = "convert",
    description = "Convert legacy .doc documents to .docx using LibreOffice",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(
        index = "0",
        paramLabel = "FOLDER",
        description = "Folder searched recursively for .doc documents"
    )
    private Path folder;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: spec-harvest.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        if (!Files.isDirectory(folder)) {
            System.err.println("✗ Not a directory: " + folder);
            return 1;
        }

        HarvestConfig config = ConfigLoader.load(configPath);
        LibreOfficeConverter converter = LibreOfficeConverter.from(config.converter());

        try {
            List<ConversionResult> results = converter.convertAll(folder);
            if (results.isEmpty()) {
                System.out.println("No .doc documents found in " + folder.toAbsolutePath());
                return 0;
            }

            int failed = 0;
            for (ConversionResult result : results) {
                if (result.success()) {
                    System.out.println("✓ " + result.source().getFileName() + " -> " + result.converted().getFileName());
                } else {
                    System.out.println("✗ " + result.source().getFileName() + ": " + result.message());
                    failed++;
                }
            }
            return failed == 0 ? 0 : 1;

        } catch (IOException e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }
}
