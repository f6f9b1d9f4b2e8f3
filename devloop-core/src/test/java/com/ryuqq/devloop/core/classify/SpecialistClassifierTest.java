package com.ryuqq.devloop.core.classify;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SpecialistClassifier 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SpecialistClassifierTest {

    private final SpecialistClassifier classifier = SpecialistClassifier.withDefaults();

    @Test
    void classify_LongestPhraseWins() {
        Classification result = classifier.classify("Add rate limiting to the global controller");

        assertThat(result.kind()).isEqualTo(Classification.Kind.MATCHED);
        assertThat(result.label()).isEqualTo("global-controller");
    }

    @Test
    void classify_MultiWordBeatsSingleWord() {
        Classification result = classifier.classify("Fix the key rotation bug in the database layer");

        assertThat(result.labelIfMatched()).contains("auth-controller");
    }

    @Test
    void classify_EqualSpecificity_Ambiguous() {
        SpecialistClassifier table = new SpecialistClassifier(Map.of(
            "database", List.of("schema"),
            "protocol", List.of("packet")
        ));

        Classification result = table.classify("change the schema and the packet");

        assertThat(result.isAmbiguous()).isTrue();
        assertThat(result.candidates()).containsExactly("database", "protocol");
        assertThat(result.labelIfMatched()).isEmpty();
    }

    @Test
    void classify_NoKeyword_Unmatched() {
        assertThat(classifier.classify("Rename a variable").kind()).isEqualTo(Classification.Kind.UNMATCHED);
        assertThat(classifier.classify(" ").kind()).isEqualTo(Classification.Kind.UNMATCHED);
    }

    @Test
    void classify_MatchCountBreaksTies() {
        SpecialistClassifier table = new SpecialistClassifier(Map.of(
            "observability", List.of("metrics", "alert"),
            "database", List.of("sqlite")
        ));

        // metrics(7) vs sqlite(6): 글자 수에서 결정
        assertThat(table.classify("metrics for sqlite").label()).isEqualTo("observability");

        SpecialistClassifier sameLength = new SpecialistClassifier(Map.of(
            "observability", List.of("metric", "alert"),
            "database", List.of("schema")
        ));
        assertThat(sameLength.classify("metric alert schema").label()).isEqualTo("observability");
    }
}
