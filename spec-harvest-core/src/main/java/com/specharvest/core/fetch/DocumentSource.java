package com.specharvest.core.fetch;

import com.specharvest.core.model.SpecificationId;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Supplies the local document containers of a specification.
 */
@FunctionalInterface
public interface DocumentSource {

    /**
     * Retrieves a specification's documents into the workspace.
     *
     * @param id specification to retrieve
     * @param workspace directory receiving the specification folder
     * @return paths of the retrieved {@code .doc}/{@code .docx} files (possibly empty)
     * @throws IOException if retrieval fails; other specifications are unaffected
     */
    List<Path> fetch(SpecificationId id, Path workspace) throws IOException;
}
