package com.specharvest.core.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog of field label patterns.
 *
 * <p>A label matches case-insensitively at the start of the (already trimmed) text. Labels
 * that carry an inline value must be followed by a colon (whitespace around it allowed), so
 * "Purpose: x" matches while "Purpose built tools" and "Purposeful" stay plain text.
 * Everything after the colon is the inline value. The {@code Execution Steps} header needs
 * no colon: it matches when followed by a colon, whitespace or the end of the text.
 *
 * <p>Patterns are compiled once; an instance is immutable and can be shared between
 * concurrent parses.
 *
 * <pre>{@code
 * FieldGrammar grammar = FieldGrammar.standard();
 * grammar.classify("Requirement Name: Logging")
 *     // -> FieldMatch[kind=REQUIREMENT_NAME, inlineValue=Logging]
 * }</pre>
 */
public final class FieldGrammar {

    private static final FieldGrammar STANDARD = new FieldGrammar();

    private final Map<FieldKind, Pattern> patterns;

    private FieldGrammar() {
        Map<FieldKind, Pattern> compiled = new EnumMap<>(FieldKind.class);
        for (FieldKind kind : FieldKind.values()) {
            compiled.put(kind, compile(kind));
        }
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    /**
     * Returns the shared grammar instance.
     *
     * @return standard grammar
     */
    public static FieldGrammar standard() {
        return STANDARD;
    }

    private static Pattern compile(FieldKind kind) {
        String boundary = kind.hasInlineValue() ? "\\s*:\\s*" : "(?:\\s*:\\s*|\\s+|$)";
        return Pattern.compile(
            "^" + Pattern.quote(kind.label()) + boundary + "(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
        );
    }

    /**
     * Classifies text against every label in catalog order.
     *
     * @param text normalized paragraph text
     * @return the first matching label, or empty if the text carries no label
     */
    public Optional<FieldMatch> classify(String text) {
        for (FieldKind kind : FieldKind.values()) {
            Optional<FieldMatch> match = match(kind, text);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Tests text against a single label.
     *
     * @param kind label to test
     * @param text normalized paragraph text
     * @return the match, or empty
     */
    public Optional<FieldMatch> match(FieldKind kind, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = patterns.get(kind).matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String inline = kind.hasInlineValue() ? matcher.group(1).strip() : "";
        return Optional.of(new FieldMatch(kind, inline));
    }
}
