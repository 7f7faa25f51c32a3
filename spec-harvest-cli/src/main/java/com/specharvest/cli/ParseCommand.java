package com.specharvest.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.specharvest.core.document.DocumentReadException;
import com.specharvest.core.document.DocxParagraphReader;
import com.specharvest.core.model.ParseDiagnostics;
import com.specharvest.core.model.ParseResult;
import com.specharvest.core.output.OutputBundle;
import com.specharvest.core.output.OutputContext;
import com.specharvest.core.output.OutputFile;
import com.specharvest.core.output.OutputWriter;
import com.specharvest.core.output.impl.ConsoleWriter;
import com.specharvest.core.output.impl.FileSystemWriter;
import com.specharvest.core.parser.SpecificationParser;
import com.specharvest.core.renderer.SpecificationRenderer;
import com.specharvest.core.renderer.SpecificationRenderers;
import com.specharvest.core.util.FileUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to extract records from local .docx documents.
 *
 * <p>Without {@code --output} the rendered trees are printed to standard output; with it,
 * one file per document is written to the directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the XML tree of a document
 * spec-harvest parse 33117-j20.docx
 *
 * # Write Markdown for several documents with parse statistics
 * spec-harvest parse *.docx -f markdown -o out --stats
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Extract requirements and test cases from local .docx documents",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "FILE",
        description = ".docx documents to parse"
    )
    private List<Path> files;

    @Option(
        names = {"-n", "--name"},
        description = "Root name of the extracted tree (default: document file name)"
    )
    private String name;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: xml, json or markdown (default: xml)",
        defaultValue = "xml"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: print to console)"
    )
    private Path outputDir;

    @Option(
        names = {"--stats"},
        description = "Print parse statistics and warnings"
    )
    private boolean stats;

    @Override
    public Integer call() {
        SpecificationRenderer renderer;
        try {
            renderer = SpecificationRenderers.resolve(List.of(format)).get(0);
        } catch (IllegalArgumentException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        DocxParagraphReader reader = new DocxParagraphReader();
        SpecificationParser parser = new SpecificationParser();
        List<OutputFile> outputs = new ArrayList<>();
        int failures = 0;

        for (Path file : files) {
            if (!reader.supports(file)) {
                System.err.println("✗ Not a .docx document: " + file);
                failures++;
                continue;
            }
            try {
                ParseResult result = parser.parse(rootName(file), reader.read(file));
                outputs.add(new OutputFile(
                    FileUtils.replaceExtension(file, renderer.getFileExtension()),
                    renderer.render(result.specification()),
                    renderer.getContentType()));
                if (stats) {
                    printStatistics(file, result.diagnostics());
                }
            } catch (DocumentReadException e) {
                log.debug("Failed to read {}", file, e);
                System.err.println("✗ " + e.getMessage());
                failures++;
            }
        }

        if (!outputs.isEmpty()) {
            try {
                write(outputs);
            } catch (IllegalStateException e) {
                log.error("Writing output failed", e);
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
        }

        return failures == 0 ? 0 : 1;
    }

    private String rootName(Path file) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private void write(List<OutputFile> outputs) {
        OutputWriter writer;
        OutputContext context;
        if (outputDir == null) {
            writer = new ConsoleWriter(System.out);
            context = new OutputContext(Path.of("."), Map.of());
        } else {
            writer = new FileSystemWriter();
            context = new OutputContext(outputDir, Map.of());
        }
        writer.write(new OutputBundle(outputs), context);
        if (outputDir != null) {
            System.out.println("✓ Wrote " + outputs.size() + " file(s) to " + outputDir.toAbsolutePath());
        }
    }

    private static void printStatistics(Path file, ParseDiagnostics diagnostics) {
        System.err.printf("%s: %d paragraph(s), %d heading(s), %d requirement(s), %d test case(s), %d discarded%n",
            file.getFileName(),
            diagnostics.paragraphsRead(),
            diagnostics.headings(),
            diagnostics.requirements(),
            diagnostics.testCases(),
            diagnostics.paragraphsDiscarded());
        for (String warning : diagnostics.warnings()) {
            System.err.println("  ! " + warning);
        }
    }
}
