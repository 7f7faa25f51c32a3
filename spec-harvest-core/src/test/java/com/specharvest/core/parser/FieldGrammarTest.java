package com.specharvest.core.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class FieldGrammarTest {

    private final FieldGrammar grammar = FieldGrammar.standard();

    @Test
    void classify_withColonLabel_extractsInlineValue() {
        assertThat(grammar.classify("Requirement Name: Logging"))
            .contains(new FieldMatch(FieldKind.REQUIREMENT_NAME, "Logging"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Purpose To verify that logging works",
        "Purpose built tools are used",
        "Expected Results",
        "Requirement Name Logging"
    })
    void classify_inlineLabelWithoutColon_returnsEmpty(String text) {
        assertThat(grammar.classify(text)).isEmpty();
    }

    @Test
    void classify_withSpaceBeforeColon_extractsInlineValue() {
        assertThat(grammar.classify("Threat References : T1, T2"))
            .contains(new FieldMatch(FieldKind.THREAT_REFERENCES, "T1, T2"));
    }

    @Test
    void classify_ignoresLabelCase() {
        assertThat(grammar.classify("TEST NAME: TC_LOG_1"))
            .contains(new FieldMatch(FieldKind.TEST_NAME, "TC_LOG_1"));
    }

    @Test
    void classify_withColonOnly_returnsEmptyInlineValue() {
        assertThat(grammar.classify("Expected Results:"))
            .contains(new FieldMatch(FieldKind.EXPECTED_RESULTS, ""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Execution Steps", "Execution Steps:", "execution steps (informative)"})
    void classify_executionStepsHeader_needsNoColon(String text) {
        assertThat(grammar.classify(text))
            .contains(new FieldMatch(FieldKind.EXECUTION_STEPS, ""));
    }

    @Test
    void classify_executionStepsHeader_discardsInlineText() {
        assertThat(grammar.classify("Execution Steps: step one"))
            .contains(new FieldMatch(FieldKind.EXECUTION_STEPS, ""));
    }

    @Test
    void classify_preConditionsWithHyphen_matches() {
        assertThat(grammar.classify("Pre-Conditions: device is booted"))
            .contains(new FieldMatch(FieldKind.PRE_CONDITIONS, "device is booted"));
    }

    @Test
    void classify_evidenceFormatLabel_matches() {
        assertThat(grammar.classify("Expected Format of Evidence: screenshots"))
            .contains(new FieldMatch(FieldKind.EVIDENCE_FORMAT, "screenshots"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Purposeful design is key",
        "The Requirement Name: appears mid-sentence",
        "Testing Name: not a label",
        "Requirement Names: plural"
    })
    void classify_withoutLabelAtBoundary_returnsEmpty(String text) {
        assertThat(grammar.classify(text)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(FieldKind.class)
    void match_everyLabel_matchesItsOwnKind(FieldKind kind) {
        assertThat(grammar.match(kind, kind.label() + ": value"))
            .hasValueSatisfying(match -> assertThat(match.kind()).isEqualTo(kind));
    }

    @Test
    void match_withOtherKind_returnsEmpty() {
        assertThat(grammar.match(FieldKind.PURPOSE, "Requirement Name: x")).isEmpty();
    }

    @Test
    void match_withEmptyText_returnsEmpty() {
        assertThat(grammar.match(FieldKind.PURPOSE, "")).isEmpty();
    }
}
