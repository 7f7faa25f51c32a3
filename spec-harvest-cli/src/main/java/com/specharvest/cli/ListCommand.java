package com.specharvest.cli;

import com.specharvest.core.config.ConfigLoader;
import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.model.SpecificationId;
import com.specharvest.core.output.OutputWriter;
import com.specharvest.core.output.OutputWriters;
import com.specharvest.core.renderer.SpecificationRenderer;
import com.specharvest.core.renderer.SpecificationRenderers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list configured specifications, renderers or writers.
 *
 * <p>Renderers and writers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List the specifications that extract would process
 * spec-harvest list specifications
 *
 * # List output formats
 * spec-harvest list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List configured specifications, renderers or writers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: specifications, renderers or writers"
    )
    private String type;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: spec-harvest.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "specifications", "specification", "specs" -> listSpecifications();
            case "renderers", "renderer", "formats" -> listRenderers();
            case "writers", "writer" -> listWriters();
            default -> {
                log.error("Unknown type: {}. Use: specifications, renderers or writers", type);
                yield 1;
            }
        };
    }

    private int listSpecifications() {
        List<SpecificationId> ids = ConfigLoader.load(configPath).specificationIds();
        System.out.println("Configured Specifications:");
        System.out.println();

        for (SpecificationId id : ids) {
            System.out.printf("  • %s (folder: %s)%n", id, id.folderName());
        }
        if (ids.isEmpty()) {
            System.out.println("  No specifications configured.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<SpecificationRenderer> renderers = SpecificationRenderers.discover();
        for (SpecificationRenderer renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    File Extension: .%s%n", renderer.getFileExtension());
            System.out.printf("    Content Type: %s%n", renderer.getContentType());
            System.out.println();
        }
        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listWriters() {
        System.out.println("Available Writers:");
        System.out.println();

        List<OutputWriter> writers = OutputWriters.discover();
        for (OutputWriter writer : writers) {
            System.out.printf("  • %s%n", writer.getId());
        }
        if (writers.isEmpty()) {
            System.out.println("  No writers found.");
        }
        return 0;
    }
}
