package com.specharvest.core.parser;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets paragraph style names as heading levels.
 *
 * <p>Word exposes built-in heading styles under several spellings: the display name
 * ("Heading 2"), the name stored in {@code styles.xml} ("heading 2") and the style id
 * ("Heading2"). All of them denote a heading; the level is the trailing integer.
 */
public final class HeadingStyles {

    private static final String HEADING_PREFIX = "heading";
    private static final Pattern LEVEL_SUFFIX = Pattern.compile("^heading\\s*(\\d+)$", Pattern.CASE_INSENSITIVE);

    private HeadingStyles() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns whether a style denotes a heading.
     *
     * @param style style name, may be null
     * @return true for any style starting with "Heading" (case-insensitive)
     */
    public static boolean isHeading(String style) {
        return style != null && style.strip().toLowerCase(Locale.ROOT).startsWith(HEADING_PREFIX);
    }

    /**
     * Reads the level encoded in a heading style.
     *
     * @param style heading style name
     * @return the level, or empty if the suffix is missing, non-numeric or below 1
     */
    public static OptionalInt level(String style) {
        if (!isHeading(style)) {
            return OptionalInt.empty();
        }
        Matcher matcher = LEVEL_SUFFIX.matcher(style.strip());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        try {
            int level = Integer.parseInt(matcher.group(1));
            return level >= 1 ? OptionalInt.of(level) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return OptionalInt.empty();
        }
    }
}
