package com.specharvest.core.parser;

import com.specharvest.core.model.ParseDiagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * Parse state of one document: the open record, the field capturing continuation lines,
 * and the section path.
 *
 * <p>Each normalized paragraph goes through {@link #accept(String, String)}, which applies
 * the first applicable step:
 * <ol>
 *   <li>A heading style closes the open record and opens a section.</li>
 *   <li>The rules of {@link #RULES}, in order. Name labels apply in any state; other labels
 *       apply only while a record of their kind is open.</li>
 *   <li>Otherwise the text continues the capturing field, or is discarded when no field
 *       is capturing.</li>
 * </ol>
 *
 * <p>The rule order is part of the observable behavior: a "Test Name" line closes an open
 * requirement, and "Purpose:" inside a requirement description is body text, not a
 * field.
 *
 * <p>A label that repeats within one record does not overwrite the field: its inline value
 * is appended to the earlier value on a new line, capture resumes on that field, and a
 * warning is recorded.
 *
 * <p>The capture target is a {@link FieldKind}, resolved against the open record when a
 * line is appended. Instances are single-use and not thread-safe.
 */
public final class RecordContext {

    private static final Logger log = LoggerFactory.getLogger(RecordContext.class);

    private static final Predicate<RecordScope> ANY_SCOPE = scope -> true;

    /**
     * A label test guarded by the record scope it applies in.
     *
     * @param applies scope guard
     * @param kind label to test
     */
    private record Rule(Predicate<RecordScope> applies, FieldKind kind) {}

    private static final List<Rule> RULES = List.of(
        new Rule(ANY_SCOPE, FieldKind.REQUIREMENT_NAME),
        new Rule(scope -> scope == RecordScope.REQUIREMENT, FieldKind.REQUIREMENT_REFERENCE),
        new Rule(scope -> scope == RecordScope.REQUIREMENT, FieldKind.REQUIREMENT_DESCRIPTION),
        new Rule(scope -> scope == RecordScope.REQUIREMENT, FieldKind.THREAT_REFERENCES),
        new Rule(ANY_SCOPE, FieldKind.TEST_NAME),
        new Rule(scope -> scope == RecordScope.TEST_CASE, FieldKind.PURPOSE),
        new Rule(scope -> scope == RecordScope.TEST_CASE, FieldKind.PRE_CONDITIONS),
        new Rule(scope -> scope == RecordScope.TEST_CASE, FieldKind.EXECUTION_STEPS),
        new Rule(scope -> scope == RecordScope.TEST_CASE, FieldKind.EXPECTED_RESULTS),
        new Rule(scope -> scope == RecordScope.TEST_CASE, FieldKind.EVIDENCE_FORMAT)
    );

    private final FieldGrammar grammar;
    private final TreeBuilder builder;
    private final SectionStack sections;

    private TreeBuilder.RecordDraft openRecord;
    private FieldKind capture;

    private int headings;
    private int requirements;
    private int testCases;
    private int discarded;
    private int malformedHeadings;
    private final List<String> warnings = new ArrayList<>();

    /**
     * Creates a context that writes into the given tree.
     *
     * @param grammar label catalog
     * @param builder tree under construction
     */
    public RecordContext(FieldGrammar grammar, TreeBuilder builder) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.sections = new SectionStack(builder);
    }

    /**
     * Processes one non-empty normalized paragraph.
     *
     * @param text normalized text
     * @param style paragraph style name, may be null
     */
    public void accept(String text, String style) {
        if (HeadingStyles.isHeading(style)) {
            enterHeading(text, style);
            return;
        }

        RecordScope scope = scope();
        for (Rule rule : RULES) {
            if (!rule.applies().test(scope)) {
                continue;
            }
            Optional<FieldMatch> match = grammar.match(rule.kind(), text);
            if (match.isPresent()) {
                apply(match.get());
                return;
            }
        }

        continueCapture(text);
    }

    private void enterHeading(String title, String style) {
        OptionalInt parsed = HeadingStyles.level(style);
        int level = parsed.orElse(1);
        if (parsed.isEmpty()) {
            malformedHeadings++;
            warn("Malformed heading style '" + style + "' on '" + title + "'; using level 1");
        }

        closeRecord();
        sections.enter(level, title);
        headings++;
    }

    private void apply(FieldMatch match) {
        FieldKind kind = match.kind();
        switch (kind.role()) {
            case OPENS_RECORD -> openRecord(kind, match.inlineValue());
            case SINGLE_LINE, MULTI_LINE, HEADER -> setField(kind, match.inlineValue());
        }
    }

    private void openRecord(FieldKind kind, String name) {
        closeRecord();
        TreeBuilder.Container parent = sections.current();
        if (kind == FieldKind.REQUIREMENT_NAME) {
            openRecord = builder.addRequirement(parent, name);
            requirements++;
        } else {
            openRecord = builder.addTestCase(parent, name);
            testCases++;
        }
    }

    private void setField(FieldKind kind, String inlineValue) {
        if (openRecord.has(kind)) {
            warn("Repeated '" + kind.label() + "' label in '" + openRecord.name() + "'; appending to the earlier value");
            if (!inlineValue.isEmpty()) {
                openRecord.append(kind, inlineValue);
            }
        } else {
            openRecord.set(kind, inlineValue);
        }
        capture = kind.capturesContinuation() ? kind : null;
    }

    private void continueCapture(String text) {
        if (capture != null && openRecord != null) {
            openRecord.append(capture, text);
        } else {
            discarded++;
        }
    }

    private void closeRecord() {
        openRecord = null;
        capture = null;
    }

    private void warn(String message) {
        log.debug(message);
        if (warnings.size() < ParseDiagnostics.MAX_WARNINGS) {
            warnings.add(message);
        }
    }

    /**
     * Returns the kind of the open record.
     *
     * @return open record scope, NONE when no record is open
     */
    public RecordScope scope() {
        return openRecord == null ? RecordScope.NONE : openRecord.kind();
    }

    /**
     * Returns the field currently receiving continuation lines.
     *
     * @return capture target, or null
     */
    public FieldKind captureTarget() {
        return capture;
    }

    /**
     * Returns the nesting depth of the innermost open section.
     *
     * @return 0 before the first heading
     */
    public int sectionDepth() {
        return sections.depth();
    }

    /**
     * Builds diagnostics from the counters gathered so far.
     *
     * @param paragraphsRead paragraphs received by the driver
     * @param paragraphsSkipped paragraphs the driver skipped as empty
     * @return diagnostics snapshot
     */
    public ParseDiagnostics diagnostics(int paragraphsRead, int paragraphsSkipped) {
        return new ParseDiagnostics(
            paragraphsRead,
            paragraphsSkipped,
            headings,
            requirements,
            testCases,
            discarded,
            malformedHeadings,
            warnings
        );
    }
}
