package com.specharvest.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.specharvest.core.config.ConfigLoader;
import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.model.SpecificationId;
import com.specharvest.core.pipeline.DocumentOutcome;
import com.specharvest.core.pipeline.ExtractionPipeline;
import com.specharvest.core.pipeline.ExtractionReport;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to download specifications and extract their records.
 *
 * <p>Runs the full pipeline for each selected specification:
 * <ol>
 *   <li>Download and unpack the latest archive</li>
 *   <li>Convert legacy .doc documents with LibreOffice</li>
 *   <li>Parse every .docx document</li>
 *   <li>Write one output file per format next to each document</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All configured specifications
 * spec-harvest extract
 *
 * # Selected specifications, JSON output, 8 threads
 * spec-harvest extract 33.117 33.216 -f json -t 8
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Download specifications and extract requirements and test cases",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(
        arity = "0..*",
        paramLabel = "NUMBER",
        description = "Specification numbers, e.g. 33.117 (default: all configured)"
    )
    private List<String> numbers = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: spec-harvest.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-f", "--format"},
        description = "Output format: xml, json or markdown (repeatable, overrides config)"
    )
    private List<String> formats;

    @Option(
        names = {"-w", "--workspace"},
        description = "Workspace directory (overrides config)"
    )
    private Path workspace;

    @Option(
        names = {"-t", "--threads"},
        description = "Specifications processed in parallel (overrides config)"
    )
    private Integer threads;

    @Override
    public Integer call() {
        try {
            HarvestConfig config = applyOverrides(ConfigLoader.load(configPath));
            List<SpecificationId> ids = config.resolve(numbers);
            if (ids.isEmpty()) {
                System.err.println("✗ No specifications selected");
                return 1;
            }

            System.out.println("Harvesting " + ids.size() + " specification(s) into "
                + Paths.get(config.output().workspace()).toAbsolutePath());
            System.out.println();

            ExtractionReport report = ExtractionPipeline.from(config).run(ids);
            printReport(report);

            return report.failed() == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Extraction failed", e);
            System.err.println("✗ Extraction failed: " + e.getMessage());
            return 1;
        }
    }

    private HarvestConfig applyOverrides(HarvestConfig config) {
        HarvestConfig.OutputSettings output = config.output();
        HarvestConfig.OutputSettings overridden = new HarvestConfig.OutputSettings(
            workspace != null ? workspace.toString() : output.workspace(),
            formats != null && !formats.isEmpty() ? formats : output.formats(),
            threads != null ? threads : output.threads()
        );
        log.debug("Output settings: {}", overridden);
        return new HarvestConfig(config.archive(), config.specifications(), config.converter(), overridden);
    }

    private void printReport(ExtractionReport report) {
        for (DocumentOutcome outcome : report.outcomes()) {
            switch (outcome.status()) {
                case SUCCESS -> System.out.printf("✓ %s: %d record(s) from %d document(s)%n",
                    outcome.id(), outcome.records(), outcome.documents().size());
                case PARTIAL -> System.out.printf("⚠ %s: %d record(s) from %d document(s), %d skipped%n",
                    outcome.id(), outcome.records(), outcome.documents().size(), outcome.problems().size());
                case FAILED -> System.out.printf("✗ %s: %s%n", outcome.id(), outcome.message());
            }
            for (String problem : outcome.problems()) {
                System.out.println("    - " + problem);
            }
        }
        System.out.println();
        System.out.printf("Done: %d succeeded, %d partial, %d failed, %d record(s) total%n",
            report.succeeded(), report.partial(), report.failed(), report.totalRecords());
    }
}
