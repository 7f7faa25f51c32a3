package com.specharvest.core.parser;

/**
 * Field labels recognized in document body text, in catalog order.
 *
 * <p>Requirement labels precede test case labels; {@link FieldGrammar#classify(String)}
 * relies on this order when a paragraph could match more than one label.
 */
public enum FieldKind {

    REQUIREMENT_NAME("Requirement Name", RecordScope.REQUIREMENT, Role.OPENS_RECORD),
    REQUIREMENT_REFERENCE("Requirement Reference", RecordScope.REQUIREMENT, Role.SINGLE_LINE),
    REQUIREMENT_DESCRIPTION("Requirement Description", RecordScope.REQUIREMENT, Role.MULTI_LINE),
    THREAT_REFERENCES("Threat References", RecordScope.REQUIREMENT, Role.SINGLE_LINE),

    TEST_NAME("Test Name", RecordScope.TEST_CASE, Role.OPENS_RECORD),
    PURPOSE("Purpose", RecordScope.TEST_CASE, Role.MULTI_LINE),
    PRE_CONDITIONS("Pre-Conditions", RecordScope.TEST_CASE, Role.MULTI_LINE),
    /** Header-only label: the steps are the continuation lines that follow it. */
    EXECUTION_STEPS("Execution Steps", RecordScope.TEST_CASE, Role.HEADER),
    EXPECTED_RESULTS("Expected Results", RecordScope.TEST_CASE, Role.MULTI_LINE),
    EVIDENCE_FORMAT("Expected Format of Evidence", RecordScope.TEST_CASE, Role.MULTI_LINE);

    /**
     * How a label affects the record state.
     */
    public enum Role {
        /** Closes the open record and opens a new one named by the inline value. */
        OPENS_RECORD,
        /** Sets a field from the inline value; later lines do not attach. */
        SINGLE_LINE,
        /** Sets a field from the inline value and captures continuation lines. */
        MULTI_LINE,
        /** Opens an empty field that captures continuation lines; inline text is ignored. */
        HEADER
    }

    private final String label;
    private final RecordScope scope;
    private final Role role;

    FieldKind(String label, RecordScope scope, Role role) {
        this.label = label;
        this.scope = scope;
        this.role = role;
    }

    public String label() {
        return label;
    }

    /**
     * Returns the record kind this label belongs to.
     *
     * @return requirement or test case scope
     */
    public RecordScope scope() {
        return scope;
    }

    public Role role() {
        return role;
    }

    /**
     * Returns whether continuation paragraphs attach to this field.
     *
     * @return true for multi-line and header fields
     */
    public boolean capturesContinuation() {
        return role == Role.MULTI_LINE || role == Role.HEADER;
    }

    /**
     * Returns whether the text after the label becomes the field's initial value.
     *
     * @return false only for header labels
     */
    public boolean hasInlineValue() {
        return role != Role.HEADER;
    }
}
