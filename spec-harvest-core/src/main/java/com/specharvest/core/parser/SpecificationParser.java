package com.specharvest.core.parser;

import com.specharvest.core.model.Paragraph;
import com.specharvest.core.model.ParseDiagnostics;
import com.specharvest.core.model.ParseResult;
import com.specharvest.core.model.Specification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a paragraph stream into a {@link Specification} tree.
 *
 * <p>Single pass, no lookahead. The parser never throws on content: unknown text is
 * either attached to the capturing field or dropped, and malformed heading styles fall
 * back to level 1. It performs no I/O.
 *
 * <p>All per-document state lives in a {@link RecordContext} created by each call, so one
 * parser can serve concurrent parses.
 *
 * <pre>{@code
 * SpecificationParser parser = new SpecificationParser();
 * ParseResult result = parser.parse("3GPP TS 33.117", List.of(
 *     Paragraph.heading(1, "4 Requirements"),
 *     Paragraph.body("Requirement Name: Logging"),
 *     Paragraph.body("Requirement Description: System shall log.")
 * ));
 * }</pre>
 */
public class SpecificationParser {

    private static final Logger log = LoggerFactory.getLogger(SpecificationParser.class);

    private final FieldGrammar grammar;

    /**
     * Creates a parser with the standard label catalog.
     */
    public SpecificationParser() {
        this(FieldGrammar.standard());
    }

    /**
     * Creates a parser with the given label catalog.
     *
     * @param grammar label catalog
     */
    public SpecificationParser(FieldGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
    }

    /**
     * Parses one document.
     *
     * @param documentName root label of the resulting tree
     * @param paragraphs paragraphs in document order
     * @return the tree and parse diagnostics
     */
    public ParseResult parse(String documentName, Iterable<Paragraph> paragraphs) {
        Objects.requireNonNull(paragraphs, "paragraphs must not be null");

        TreeBuilder builder = new TreeBuilder(documentName);
        RecordContext context = new RecordContext(grammar, builder);

        int read = 0;
        int skipped = 0;
        for (Paragraph paragraph : paragraphs) {
            read++;
            String text = TextNormalizer.normalize(paragraph.text());
            if (text.isEmpty()) {
                skipped++;
                continue;
            }
            context.accept(text, paragraph.style());
        }

        ParseDiagnostics diagnostics = context.diagnostics(read, skipped);
        log.debug("Parsed {}: {} paragraphs, {} sections, {} requirements, {} test cases, {} discarded",
            documentName,
            read,
            diagnostics.headings(),
            diagnostics.requirements(),
            diagnostics.testCases(),
            diagnostics.paragraphsDiscarded());

        return new ParseResult(builder.build(), diagnostics);
    }
}
