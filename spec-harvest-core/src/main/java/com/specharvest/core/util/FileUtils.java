package com.specharvest.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files with the given extension below a root directory, ignoring case.
     *
     * <p>Office lock files ({@code ~$name.docx}) are skipped.
     *
     * @param rootPath root directory to search from
     * @param extension extension without dot (e.g. "docx")
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findByExtension(Path rootPath, String extension) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> getExtension(path).equalsIgnoreCase(extension))
                .filter(path -> !path.getFileName().toString().startsWith("~$"))
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Returns the file name with its extension replaced.
     *
     * @param path file path
     * @param extension new extension without dot
     * @return file name only (no directories) with the new extension
     */
    public static String replaceExtension(Path path, String extension) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String base = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        return base + "." + extension.toLowerCase(Locale.ROOT);
    }
}
