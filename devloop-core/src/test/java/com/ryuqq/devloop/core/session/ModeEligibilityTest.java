package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.check.ArtifactKind;
import com.ryuqq.devloop.core.model.Mode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModeEligibilityTest {

    @Test
    void evaluate_LightweightTouchingManifest_FallsBackToFull() {
        ModeDecision decision = ModeEligibility.evaluate(Mode.LIGHTWEIGHT,
            List.of("src/main/java/App.java", "pom.xml"));

        assertThat(decision.effective()).isEqualTo(Mode.FULL);
        assertThat(decision.fellBack()).isTrue();
        assertThat(decision.sensitiveKinds()).containsExactly(ArtifactKind.DEPENDENCY_MANIFEST);
        assertThat(decision.sensitivePaths()).containsExactly("pom.xml");
        assertThat(decision.auditNote()).contains("DEPENDENCY_MANIFEST", "pom.xml");
    }

    @Test
    void evaluate_LightweightOrdinarySource_StaysLightweight() {
        ModeDecision decision = ModeEligibility.evaluate(Mode.LIGHTWEIGHT,
            List.of("src/main/java/App.java", "README.md"));

        assertThat(decision.effective()).isEqualTo(Mode.LIGHTWEIGHT);
        assertThat(decision.fellBack()).isFalse();
    }

    @Test
    void evaluate_FullRequested_NeverChanges() {
        ModeDecision decision = ModeEligibility.evaluate(Mode.FULL, List.of("pom.xml"));

        assertThat(decision.effective()).isEqualTo(Mode.FULL);
        assertThat(decision.fellBack()).isFalse();
    }
}
