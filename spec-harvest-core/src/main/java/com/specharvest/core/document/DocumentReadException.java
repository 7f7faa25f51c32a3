package com.specharvest.core.document;

import java.nio.file.Path;

/**
 * Raised when a document container cannot be opened or decoded.
 */
public class DocumentReadException extends Exception {

    private final Path path;

    public DocumentReadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    /**
     * Returns the document that failed to read.
     *
     * @return document path
     */
    public Path getPath() {
        return path;
    }
}
