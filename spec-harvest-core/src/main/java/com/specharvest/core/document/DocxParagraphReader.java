package com.specharvest.core.document;

import com.specharvest.core.model.Paragraph;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the paragraph stream of a {@code .docx} file with Apache POI.
 *
 * <p>Only top-level body paragraphs are returned, in document order; table cells, headers
 * and footers are not part of the stream. The style of each paragraph is reported by name
 * as declared in the document's style table ("heading 2"), falling back to the style id
 * ("Heading2") when the style is not declared, and to "Normal" when the paragraph has no
 * style.
 */
public class DocxParagraphReader implements ParagraphSource {

    private static final Logger log = LoggerFactory.getLogger(DocxParagraphReader.class);

    private static final String DEFAULT_STYLE = "Normal";

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx");
    }

    @Override
    public List<Paragraph> read(Path path) throws DocumentReadException {
        log.debug("Reading paragraphs from {}", path);
        try (InputStream in = Files.newInputStream(path);
             XWPFDocument document = new XWPFDocument(in)) {

            XWPFStyles styles = document.getStyles();
            List<Paragraph> paragraphs = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                paragraphs.add(new Paragraph(paragraph.getText(), styleName(styles, paragraph.getStyle())));
            }

            log.debug("Read {} paragraphs from {}", paragraphs.size(), path.getFileName());
            return paragraphs;
        } catch (IOException e) {
            throw new DocumentReadException(path, "Failed to read document", e);
        } catch (RuntimeException e) {
            // POI reports corrupt or non-OOXML packages with unchecked exceptions
            throw new DocumentReadException(path, "Not a readable .docx document", e);
        }
    }

    private static String styleName(XWPFStyles styles, String styleId) {
        if (styleId == null || styleId.isBlank()) {
            return DEFAULT_STYLE;
        }
        if (styles != null) {
            XWPFStyle style = styles.getStyle(styleId);
            if (style != null && style.getName() != null) {
                return style.getName();
            }
        }
        return styleId;
    }
}
