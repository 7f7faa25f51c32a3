package com.specharvest.core.model;

/**
 * One element of a paragraph stream: the raw text of a document paragraph and the
 * name of the style applied to it.
 *
 * @param text raw paragraph text (may contain control characters)
 * @param style style name (e.g. "Heading 2", "Normal"); null is treated as body text
 */
public record Paragraph(
    String text,
    String style
) {
    /**
     * Compact constructor with defaults.
     */
    public Paragraph {
        if (text == null) {
            text = "";
        }
    }

    /**
     * Creates a body-text paragraph.
     *
     * @param text paragraph text
     * @return paragraph without a heading style
     */
    public static Paragraph body(String text) {
        return new Paragraph(text, "Normal");
    }

    /**
     * Creates a heading paragraph with the conventional Word style name.
     *
     * @param level heading level (1 = outermost)
     * @param text heading title
     * @return heading paragraph
     */
    public static Paragraph heading(int level, String text) {
        return new Paragraph(text, "Heading " + level);
    }
}
