package com.ryuqq.devloop.core.outcome;

import com.ryuqq.devloop.core.statemachine.Phase;

/**
 * 세션 중단.
 *
 * @param reason 중단 사유
 * @param lastKnownGoodPhase 중단 직전 단계
 * @param escalation 에스컬레이션 정보
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Abandoned(
    String reason,
    Phase lastKnownGoodPhase,
    EscalationReport escalation
) implements SessionOutcome {

    public Abandoned {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (lastKnownGoodPhase == null) {
            throw new IllegalArgumentException("lastKnownGoodPhase cannot be null");
        }
        if (escalation == null) {
            throw new IllegalArgumentException("escalation cannot be null");
        }
    }
}
