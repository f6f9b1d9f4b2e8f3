package com.ryuqq.devloop.core.outcome;

/**
 * 사람의 판단을 기다리며 정지한 세션.
 *
 * @param escalation 에스컬레이션 정보
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Escalated(EscalationReport escalation) implements SessionOutcome {

    public Escalated {
        if (escalation == null) {
            throw new IllegalArgumentException("escalation cannot be null");
        }
    }
}
