package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.core.check.VerificationLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorConfig / ActorRuntimeConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorConfigTest {

    @Test
    void defaults_세션_상한값() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThat(config.planningTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.planningRounds()).isEqualTo(3);
        assertThat(config.maxValidationAttempts()).isEqualTo(3);
        assertThat(config.maxReviewCycles()).isEqualTo(3);
        assertThat(config.reflectionTimeout()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.verificationLevel()).isEqualTo(VerificationLevel.FULL);
        assertThat(config.implementerName()).isEqualTo("implementer");
    }

    @Test
    void withPlanningGate_다른_값은_유지() {
        OrchestratorConfig config = new OrchestratorConfig()
            .withPlanningGate(Duration.ofSeconds(5), 2)
            .withMaxValidationAttempts(5);

        assertThat(config.planningTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.planningRounds()).isEqualTo(2);
        assertThat(config.maxValidationAttempts()).isEqualTo(5);
        assertThat(config.reviewTimeout()).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void 음수_또는_0_값은_거부() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThatThrownBy(() -> config.withReviewGate(Duration.ZERO, 3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reviewTimeout must be positive");
        assertThatThrownBy(() -> config.withMaxReviewCycles(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxReviewCycles must be positive");
    }

    @Test
    void actorRuntimeConfig_검증() {
        ActorRuntimeConfig config = new ActorRuntimeConfig().withMaxDeliveries(5);

        assertThat(config.maxDeliveries()).isEqualTo(5);
        assertThat(config.concurrency()).isEqualTo(16);
        assertThatThrownBy(() -> config.withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency must be positive");
    }
}
