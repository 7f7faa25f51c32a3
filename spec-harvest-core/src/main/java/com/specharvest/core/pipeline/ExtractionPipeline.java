package com.specharvest.core.pipeline;

import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.convert.ConversionResult;
import com.specharvest.core.convert.LegacyDocumentConverter;
import com.specharvest.core.convert.LibreOfficeConverter;
import com.specharvest.core.document.DocumentReadException;
import com.specharvest.core.document.DocxParagraphReader;
import com.specharvest.core.document.ParagraphSource;
import com.specharvest.core.fetch.ArchiveFetcher;
import com.specharvest.core.fetch.DocumentSource;
import com.specharvest.core.model.Paragraph;
import com.specharvest.core.model.ParseResult;
import com.specharvest.core.model.SpecificationId;
import com.specharvest.core.output.OutputBundle;
import com.specharvest.core.output.OutputContext;
import com.specharvest.core.output.OutputFile;
import com.specharvest.core.output.OutputWriter;
import com.specharvest.core.output.OutputWriters;
import com.specharvest.core.parser.SpecificationParser;
import com.specharvest.core.renderer.SpecificationRenderer;
import com.specharvest.core.renderer.SpecificationRenderers;
import com.specharvest.core.util.FileUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Harvests requirements and test cases for a batch of specifications.
 *
 * <p>Each specification goes through the same steps:
 * <ol>
 *   <li>Fetch its documents into {@code <workspace>/TS <number> - <title>/}</li>
 *   <li>Convert legacy {@code .doc} files to {@code .docx}</li>
 *   <li>Read and parse every {@code .docx} below the folder</li>
 *   <li>Render the tree in every configured format next to its source document</li>
 * </ol>
 *
 * <p>Specifications run in parallel on a fixed pool. A failure in one specification is
 * recorded in its {@link DocumentOutcome} and never affects the others. Within a
 * specification, a {@code .doc} that cannot be converted or a {@code .docx} that cannot be
 * read is skipped and listed as a problem; the specification fails only when no document
 * could be extracted or an output could not be rendered or written.
 */
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final DocumentSource documentSource;
    private final LegacyDocumentConverter converter;
    private final ParagraphSource paragraphSource;
    private final SpecificationParser parser;
    private final List<SpecificationRenderer> renderers;
    private final OutputWriter writer;
    private final Path workspace;
    private final int threads;

    public ExtractionPipeline(
            DocumentSource documentSource,
            LegacyDocumentConverter converter,
            ParagraphSource paragraphSource,
            SpecificationParser parser,
            List<SpecificationRenderer> renderers,
            OutputWriter writer,
            Path workspace,
            int threads) {
        this.documentSource = Objects.requireNonNull(documentSource, "documentSource must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.paragraphSource = Objects.requireNonNull(paragraphSource, "paragraphSource must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.renderers = List.copyOf(renderers);
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null").toAbsolutePath().normalize();
        if (this.renderers.isEmpty()) {
            throw new IllegalArgumentException("At least one renderer is required");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.threads = threads;
    }

    /**
     * Builds the production pipeline from configuration.
     *
     * @param config loaded configuration
     * @return pipeline downloading from the 3GPP archive and writing to the configured workspace
     * @throws IllegalArgumentException if a configured output format is unknown
     */
    public static ExtractionPipeline from(HarvestConfig config) {
        HarvestConfig.OutputSettings output = config.output();
        return new ExtractionPipeline(
            new ArchiveFetcher(config.archive()),
            LibreOfficeConverter.from(config.converter()),
            new DocxParagraphReader(),
            new SpecificationParser(),
            SpecificationRenderers.resolve(output.formats()),
            OutputWriters.require("filesystem"),
            Path.of(output.workspace()),
            output.threads());
    }

    /**
     * Harvests the given specifications.
     *
     * @param ids specifications to process
     * @return one outcome per specification, in request order
     */
    public ExtractionReport run(List<SpecificationId> ids) {
        if (ids.isEmpty()) {
            return new ExtractionReport(List.of());
        }

        int poolSize = Math.min(threads, ids.size());
        log.info("Harvesting {} specification(s) into {} using {} thread(s)", ids.size(), workspace, poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<DocumentOutcome>> futures = new ArrayList<>();
            for (SpecificationId id : ids) {
                futures.add(executor.submit(() -> process(id)));
            }

            List<DocumentOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                outcomes.add(await(ids.get(i), futures.get(i)));
            }
            return new ExtractionReport(outcomes);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Harvests a single specification. Never throws.
     *
     * @param id specification to process
     * @return outcome of the specification
     */
    DocumentOutcome process(SpecificationId id) {
        log.info("Processing {}", id);
        List<String> problems = new ArrayList<>();
        try {
            Path folder = workspace.resolve(id.folderName());
            List<Path> fetched = documentSource.fetch(id, workspace);
            log.debug("{}: fetched {} document(s)", id, fetched.size());

            convertLegacyDocuments(id, folder, problems);

            List<Path> documents = Files.isDirectory(folder)
                ? FileUtils.findByExtension(folder, "docx")
                : List.of();
            if (documents.isEmpty()) {
                throw new IOException("No .docx documents found in " + folder);
            }

            int records = 0;
            List<Path> extracted = new ArrayList<>();
            for (Path document : documents) {
                try {
                    records += extract(id, document);
                    extracted.add(document);
                } catch (DocumentReadException e) {
                    log.warn("{}: skipping {}: {}", id, document.getFileName(), describe(e));
                    problems.add(describe(e));
                }
            }
            if (extracted.isEmpty()) {
                throw new IOException("None of the " + documents.size() + " .docx document(s) could be read");
            }

            log.info("{}: extracted {} record(s) from {} document(s)", id, records, extracted.size());
            return DocumentOutcome.completed(id, extracted, records, problems);
        } catch (IOException | ExtractionException e) {
            log.error("{}: {}", id, describe(e));
            log.debug("{} failed", id, e);
            return DocumentOutcome.failed(id, describe(e), problems);
        } catch (RuntimeException e) {
            log.error("{}: unexpected failure", id, e);
            return DocumentOutcome.failed(id, e.getClass().getSimpleName() + ": " + e.getMessage(), problems);
        }
    }

    private void convertLegacyDocuments(SpecificationId id, Path folder, List<String> problems) throws IOException {
        if (!Files.isDirectory(folder)) {
            return;
        }
        List<ConversionResult> results = converter.convertAll(folder);
        int converted = 0;
        for (ConversionResult result : results) {
            if (result.success()) {
                converted++;
            } else {
                String problem = "Conversion of " + result.source().getFileName() + " failed: " + result.message();
                log.warn("{}: {}", id, problem);
                problems.add(problem);
            }
        }
        if (converted > 0) {
            log.info("{}: converted {} legacy document(s)", id, converted);
        }
    }

    private int extract(SpecificationId id, Path document) throws DocumentReadException {
        List<Paragraph> paragraphs = paragraphSource.read(document);
        ParseResult result = parser.parse(id.documentName(), paragraphs);

        if (!result.diagnostics().warnings().isEmpty()) {
            log.warn("{}: {} parse warning(s) in {}", id,
                result.diagnostics().warnings().size(), document.getFileName());
        }

        Path relativeDir = workspace.relativize(document.toAbsolutePath().normalize()).getParent();
        List<OutputFile> files = new ArrayList<>();
        for (SpecificationRenderer renderer : renderers) {
            String fileName = FileUtils.replaceExtension(document, renderer.getFileExtension());
            String relativePath = relativeDir == null ? fileName : relativeDir.resolve(fileName).toString();
            try {
                files.add(new OutputFile(relativePath, renderer.render(result.specification()), renderer.getContentType()));
            } catch (RuntimeException e) {
                throw new ExtractionException(id, "Failed to render " + renderer.getId() + " for " + document.getFileName(), e);
            }
        }

        try {
            writer.write(new OutputBundle(files), new OutputContext(workspace, Map.of()));
        } catch (IllegalStateException e) {
            throw new ExtractionException(id, e.getMessage(), e);
        }
        return result.diagnostics().recordCount();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private DocumentOutcome await(SpecificationId id, Future<DocumentOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DocumentOutcome.failed(id, "Interrupted");
        } catch (ExecutionException e) {
            log.error("{}: unexpected failure", id, e.getCause());
            return DocumentOutcome.failed(id, String.valueOf(e.getCause()));
        }
    }
}
