package com.specharvest.core.pipeline;

import com.specharvest.core.model.SpecificationId;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of harvesting one specification.
 *
 * @param id specification that was processed
 * @param status whether every document was extracted and written
 * @param documents {@code .docx} documents that were parsed and written
 * @param records requirements and test cases extracted across all documents
 * @param problems documents that were skipped, one line each
 * @param message failure reason, or empty unless the status is {@link OutcomeStatus#FAILED}
 */
public record DocumentOutcome(
    SpecificationId id,
    OutcomeStatus status,
    List<Path> documents,
    int records,
    List<String> problems,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentOutcome {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        documents = documents == null ? List.of() : List.copyOf(documents);
        problems = problems == null ? List.of() : List.copyOf(problems);
        if (message == null) {
            message = "";
        }
    }

    /**
     * Creates a successful outcome.
     *
     * @param id specification ID
     * @param documents parsed documents
     * @param records number of extracted records
     * @return successful outcome
     */
    public static DocumentOutcome succeeded(SpecificationId id, List<Path> documents, int records) {
        return new DocumentOutcome(id, OutcomeStatus.SUCCESS, documents, records, List.of(), "");
    }

    /**
     * Creates the outcome of a run that extracted at least one document. The status is
     * {@link OutcomeStatus#PARTIAL} when any document was skipped.
     *
     * @param id specification ID
     * @param documents parsed documents
     * @param records number of extracted records
     * @param problems skipped documents
     * @return successful or partial outcome
     */
    public static DocumentOutcome completed(SpecificationId id, List<Path> documents, int records, List<String> problems) {
        OutcomeStatus status = problems.isEmpty() ? OutcomeStatus.SUCCESS : OutcomeStatus.PARTIAL;
        return new DocumentOutcome(id, status, documents, records, problems, "");
    }

    /**
     * Creates a failed outcome.
     *
     * @param id specification ID
     * @param message failure reason
     * @return failed outcome
     */
    public static DocumentOutcome failed(SpecificationId id, String message) {
        return failed(id, message, List.of());
    }

    /**
     * Creates a failed outcome that also lists the documents skipped before the failure.
     *
     * @param id specification ID
     * @param message failure reason
     * @param problems skipped documents
     * @return failed outcome
     */
    public static DocumentOutcome failed(SpecificationId id, String message, List<String> problems) {
        return new DocumentOutcome(id, OutcomeStatus.FAILED, List.of(), 0, problems, message);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == OutcomeStatus.FAILED;
    }
}
