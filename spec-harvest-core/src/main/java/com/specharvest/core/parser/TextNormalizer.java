package com.specharvest.core.parser;

import java.util.regex.Pattern;

/**
 * Canonicalizes raw paragraph text before classification.
 *
 * <p>Removes ASCII control characters other than tab, line feed and carriage return
 * (0x00-0x08, 0x0B-0x0C, 0x0E-0x1F) and trims surrounding whitespace. Word documents
 * routinely carry field markers and soft breaks in these ranges, and a stray byte inside
 * a label ("Req\u0001uirement Name:") would otherwise defeat the prefix match.
 */
public final class TextNormalizer {

    private static final Pattern CONTROL_CHARACTERS =
        Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private TextNormalizer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Normalizes a raw paragraph.
     *
     * @param raw raw text, may be null
     * @return text without control characters and surrounding whitespace; never null
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return CONTROL_CHARACTERS.matcher(raw).replaceAll("").strip();
    }
}
