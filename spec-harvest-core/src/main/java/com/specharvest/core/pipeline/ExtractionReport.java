package com.specharvest.core.pipeline;

import java.util.List;

/**
 * Outcomes of a batch run, in the order the specifications were requested.
 *
 * @param outcomes one outcome per requested specification
 */
public record ExtractionReport(
    List<DocumentOutcome> outcomes
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long succeeded() {
        return count(OutcomeStatus.SUCCESS);
    }

    public long partial() {
        return count(OutcomeStatus.PARTIAL);
    }

    public long failed() {
        return count(OutcomeStatus.FAILED);
    }

    /**
     * Returns whether every document of every specification was harvested.
     *
     * @return true if no outcome failed or skipped a document
     */
    public boolean allSucceeded() {
        return succeeded() == outcomes.size();
    }

    /**
     * Returns the total number of extracted records across all specifications.
     *
     * @return record count
     */
    public int totalRecords() {
        return outcomes.stream().mapToInt(DocumentOutcome::records).sum();
    }

    private long count(OutcomeStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }
}
