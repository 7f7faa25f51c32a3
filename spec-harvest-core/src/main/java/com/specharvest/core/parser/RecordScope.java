package com.specharvest.core.parser;

/**
 * Which kind of record, if any, is open for field attachment.
 */
public enum RecordScope {
    /** No record open; field lines are ignored until a name label appears. */
    NONE,

    /** A requirement is open. */
    REQUIREMENT,

    /** A test case is open. */
    TEST_CASE
}
