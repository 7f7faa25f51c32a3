package com.specharvest.core.document;

import com.specharvest.core.model.Paragraph;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces the paragraph stream of a document container.
 */
public interface ParagraphSource {

    /**
     * Returns whether this source can read the given file (by extension).
     *
     * @param path document path
     * @return true if {@link #read(Path)} applies
     */
    boolean supports(Path path);

    /**
     * Reads the body paragraphs of a document in order.
     *
     * @param path document path
     * @return paragraphs with their style names
     * @throws DocumentReadException if the document cannot be opened or decoded
     */
    List<Paragraph> read(Path path) throws DocumentReadException;
}
