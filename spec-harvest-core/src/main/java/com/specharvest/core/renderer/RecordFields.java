package com.specharvest.core.renderer;

import com.specharvest.core.model.Requirement;
import com.specharvest.core.model.TestCase;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the present optional fields of a record in output order.
 *
 * <p>The record name is not included; renderers print it first.
 */
public final class RecordFields {

    private RecordFields() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns a requirement's present fields: Reference, Description, ThreatReference.
     *
     * @param requirement requirement to inspect
     * @return present fields in output order
     */
    public static List<RecordField> of(Requirement requirement) {
        List<RecordField> fields = new ArrayList<>(3);
        addIfPresent(fields, "Reference", "Requirement Reference", requirement.reference());
        addIfPresent(fields, "Description", "Requirement Description", requirement.description());
        addIfPresent(fields, "ThreatReference", "Threat References", requirement.threatReference());
        return fields;
    }

    /**
     * Returns a test case's present fields: Purpose, PreConditions, ExecutionSteps,
     * ExpectedResults, EvidenceFormat.
     *
     * @param testCase test case to inspect
     * @return present fields in output order
     */
    public static List<RecordField> of(TestCase testCase) {
        List<RecordField> fields = new ArrayList<>(5);
        addIfPresent(fields, "Purpose", "Purpose", testCase.purpose());
        addIfPresent(fields, "PreConditions", "Pre-Conditions", testCase.preConditions());
        addIfPresent(fields, "ExecutionSteps", "Execution Steps", testCase.executionSteps());
        addIfPresent(fields, "ExpectedResults", "Expected Results", testCase.expectedResults());
        addIfPresent(fields, "EvidenceFormat", "Expected Format of Evidence", testCase.evidenceFormat());
        return fields;
    }

    private static void addIfPresent(List<RecordField> fields, String element, String display, String value) {
        if (value != null && !value.isEmpty()) {
            fields.add(new RecordField(element, display, value));
        }
    }
}
