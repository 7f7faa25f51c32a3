package com.specharvest.core.pipeline;

import com.specharvest.core.convert.LibreOfficeConverter;
import com.specharvest.core.document.DocxParagraphReader;
import com.specharvest.core.fetch.DocumentSource;
import com.specharvest.core.model.SpecificationId;
import com.specharvest.core.output.OutputBundle;
import com.specharvest.core.output.OutputContext;
import com.specharvest.core.output.OutputWriter;
import com.specharvest.core.output.impl.FileSystemWriter;
import com.specharvest.core.parser.SpecificationParser;
import com.specharvest.core.renderer.SpecificationRenderers;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExtractionPipeline} with a local document source.
 */
class ExtractionPipelineTest {

    private static final SpecificationId GENERAL = new SpecificationId("33.117", "General Requirements");
    private static final SpecificationId AMF = new SpecificationId("33.512", "AMF");
    private static final SpecificationId UPF = new SpecificationId("33.513", "UPF");

    @TempDir
    Path workspace;

    @Test
    void run_writesOutputsNextToEachDocument() throws IOException {
        // Given
        DocumentSource source = (id, ws) -> List.of(writeDocx(ws.resolve(id.folderName()).resolve("33117-j20/33117-j20.docx")));
        ExtractionPipeline pipeline = pipeline(source, List.of("xml", "json"), new FileSystemWriter());

        // When
        ExtractionReport report = pipeline.run(List.of(GENERAL));

        // Then
        assertThat(report.allSucceeded()).isTrue();
        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.records()).isEqualTo(2);
        assertThat(outcome.documents()).hasSize(1);

        Path folder = workspace.resolve("TS 33.117 - General Requirements/33117-j20");
        assertThat(Files.readString(folder.resolve("33117-j20.xml")))
            .startsWith("<?xml version=")
            .contains("<Specification name=\"3GPP TS 33.117\">")
            .contains("<Name>Logging</Name>")
            .contains("<Description>System shall log.\nmore detail</Description>")
            .contains("<Purpose>Verify logging</Purpose>");
        assertThat(folder.resolve("33117-j20.json")).exists();
    }

    @Test
    void run_failureOfOneSpecification_doesNotAffectOthers() {
        // Given
        DocumentSource source = (id, ws) -> {
            if (id.equals(AMF)) {
                throw new IOException("Request failed with HTTP status 503");
            }
            return List.of(writeDocx(ws.resolve(id.folderName()).resolve(id.number() + ".docx")));
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), new FileSystemWriter());

        // When
        ExtractionReport report = pipeline.run(List.of(GENERAL, AMF, UPF));

        // Then
        assertThat(report.outcomes())
            .extracting(DocumentOutcome::id, DocumentOutcome::status)
            .containsExactly(
                tuple(GENERAL, OutcomeStatus.SUCCESS),
                tuple(AMF, OutcomeStatus.FAILED),
                tuple(UPF, OutcomeStatus.SUCCESS));
        assertThat(report.outcomes().get(1).message()).contains("503");
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(workspace.resolve("TS 33.513 - UPF/33.513.xml")).exists();
    }

    @Test
    void run_withoutDocuments_fails() {
        ExtractionPipeline pipeline = pipeline((id, ws) -> List.of(), List.of("xml"), new FileSystemWriter());

        ExtractionReport report = pipeline.run(List.of(GENERAL));

        assertThat(report.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.message()).contains("No .docx documents");
        });
    }

    @Test
    void run_unreadableDocument_isSkippedAndSiblingsAreExtracted() {
        // Given
        DocumentSource source = (id, ws) -> {
            Path folder = ws.resolve(id.folderName());
            Path broken = folder.resolve("a-broken.docx");
            Files.createDirectories(folder);
            Files.writeString(broken, "not a package");
            return List.of(broken, writeDocx(folder.resolve("b-good.docx")));
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), new FileSystemWriter());

        // When
        ExtractionReport report = pipeline.run(List.of(GENERAL));

        // Then
        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PARTIAL);
        assertThat(outcome.records()).isEqualTo(2);
        assertThat(outcome.documents()).extracting(path -> path.getFileName().toString())
            .containsExactly("b-good.docx");
        assertThat(outcome.problems()).hasSize(1);
        assertThat(outcome.problems().get(0)).contains("a-broken.docx");
        Path folder = workspace.resolve(GENERAL.folderName());
        assertThat(folder.resolve("b-good.xml")).exists();
        assertThat(folder.resolve("a-broken.xml")).doesNotExist();
        assertThat(report.failed()).isZero();
        assertThat(report.partial()).isEqualTo(1);
        assertThat(report.allSucceeded()).isFalse();
    }

    @Test
    void run_noReadableDocument_failsThatSpecification() {
        DocumentSource source = (id, ws) -> {
            Path broken = ws.resolve(id.folderName()).resolve("broken.docx");
            Files.createDirectories(broken.getParent());
            Files.writeString(broken, "not a package");
            return List.of(broken);
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), new FileSystemWriter());

        ExtractionReport report = pipeline.run(List.of(GENERAL));

        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.message()).contains("could be read");
        assertThat(outcome.problems()).hasSize(1);
        assertThat(outcome.problems().get(0)).contains("broken.docx");
    }

    @Test
    void run_unconvertibleLegacyDocument_isKeptAndDocxIsExtracted() throws IOException {
        // Given
        DocumentSource source = (id, ws) -> {
            Path folder = ws.resolve(id.folderName());
            Path legacy = folder.resolve("annex.doc");
            Files.createDirectories(folder);
            Files.writeString(legacy, "legacy");
            return List.of(legacy, writeDocx(folder.resolve("main.docx")));
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), new FileSystemWriter());

        // When
        ExtractionReport report = pipeline.run(List.of(GENERAL));

        // Then
        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PARTIAL);
        assertThat(outcome.problems()).hasSize(1);
        assertThat(outcome.problems().get(0)).startsWith("Conversion of annex.doc failed");
        Path folder = workspace.resolve(GENERAL.folderName());
        assertThat(folder.resolve("main.xml")).exists();
        assertThat(folder.resolve("annex.doc")).exists();
        assertThat(Files.readString(folder.resolve("main.xml"))).contains("<Name>Logging</Name>");
    }

    @Test
    void run_onlyUnconvertibleLegacyDocument_failsThatSpecification() {
        DocumentSource source = (id, ws) -> {
            Path legacy = ws.resolve(id.folderName()).resolve("33117-f00.doc");
            Files.createDirectories(legacy.getParent());
            Files.writeString(legacy, "legacy");
            return List.of(legacy);
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), new FileSystemWriter());

        ExtractionReport report = pipeline.run(List.of(GENERAL));

        DocumentOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.message()).contains("No .docx documents");
        assertThat(outcome.problems()).hasSize(1);
        assertThat(outcome.problems().get(0)).contains("33117-f00.doc");
    }

    @Test
    void run_writeFailure_isReportedWithSpecification() {
        DocumentSource source = (id, ws) -> List.of(writeDocx(ws.resolve(id.folderName()).resolve("doc.docx")));
        OutputWriter failingWriter = new OutputWriter() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public void write(OutputBundle bundle, OutputContext context) {
                throw new IllegalStateException("Disk full");
            }
        };
        ExtractionPipeline pipeline = pipeline(source, List.of("xml"), failingWriter);

        ExtractionReport report = pipeline.run(List.of(GENERAL));

        assertThat(report.outcomes().get(0).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(report.outcomes().get(0).message()).isEqualTo("TS 33.117: Disk full");
    }

    @Test
    void run_emptyRequest_returnsEmptyReport() {
        ExtractionPipeline pipeline = pipeline((id, ws) -> List.of(), List.of("xml"), new FileSystemWriter());

        assertThat(pipeline.run(List.of()).outcomes()).isEmpty();
    }

    @Test
    void constructor_withoutRenderers_throws() {
        assertThatThrownBy(() -> pipeline((id, ws) -> List.of(), List.of(), new FileSystemWriter()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ExtractionPipeline pipeline(DocumentSource source, List<String> formats, OutputWriter writer) {
        return new ExtractionPipeline(
            source,
            new LibreOfficeConverter(List.of(workspace.resolve("no-soffice").toString()), Duration.ofSeconds(5)),
            new DocxParagraphReader(),
            new SpecificationParser(),
            SpecificationRenderers.resolve(formats),
            writer,
            workspace,
            2);
    }

    private static Path writeDocx(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        try (XWPFDocument document = new XWPFDocument();
             OutputStream out = Files.newOutputStream(file)) {
            paragraph(document, "4.2.3 Logging", "Heading2");
            paragraph(document, "Requirement Name: Logging", null);
            paragraph(document, "Requirement Description: System shall log.", null);
            paragraph(document, "more detail", null);
            paragraph(document, "Test Name: TC_LOG", null);
            paragraph(document, "Purpose: Verify logging", null);
            document.write(out);
        }
        return file;
    }

    private static void paragraph(XWPFDocument document, String text, String style) {
        XWPFParagraph paragraph = document.createParagraph();
        if (style != null) {
            paragraph.setStyle(style);
        }
        paragraph.createRun().setText(text);
    }
}
