package com.specharvest.core.convert;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts documents from the legacy binary Word format into {@code .docx}.
 *
 * <p>A successful conversion leaves the {@code .docx} next to the original and deletes
 * the original. A failed conversion never deletes the original.
 */
public interface LegacyDocumentConverter {

    /**
     * Converts one {@code .doc} file.
     *
     * @param document legacy document
     * @return conversion outcome; failures are reported, not thrown
     */
    ConversionResult convert(Path document);

    /**
     * Converts every {@code .doc} file below a folder.
     *
     * @param folder folder to search recursively
     * @return one outcome per legacy document found
     * @throws IOException if the folder cannot be traversed
     */
    List<ConversionResult> convertAll(Path folder) throws IOException;
}
