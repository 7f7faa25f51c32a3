package com.specharvest.core.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts zip archives, keeping the archive's internal folder layout.
 */
public final class ZipExtractor {

    private ZipExtractor() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Extracts every entry of an archive below a target directory.
     *
     * @param archive zip file
     * @param targetDir extraction root
     * @return extracted regular files
     * @throws IOException if the archive is unreadable or an entry escapes the target
     */
    public static List<Path> extract(Path archive, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(root);

        List<Path> extracted = new ArrayList<>();
        try (InputStream in = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                    extracted.add(target);
                }
                zip.closeEntry();
            }
        }
        return extracted;
    }
}
