package com.specharvest.core.pipeline;

/**
 * Final state of one specification in a batch run.
 */
public enum OutcomeStatus {
    /** Every document was extracted and written. */
    SUCCESS,
    /** Some documents were extracted; others could not be converted or read. */
    PARTIAL,
    FAILED
}
