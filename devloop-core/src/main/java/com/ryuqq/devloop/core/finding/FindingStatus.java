package com.ryuqq.devloop.core.finding;

/**
 * Finding 상태.
 *
 * <pre>
 * OPEN ──► FIXED
 *   │
 *   ├──► DEFERRED_PROPOSED ──► DEFERRED_ACCEPTED
 *   │            │
 *   │            └──► ESCALATED ──► DEFERRED_ACCEPTED (adjudication)
 *   │                     │
 *   │                     └──► FIXED (route back)
 *   ├──► DEFERRED_ACCEPTED (임계값 미만, 기술 부채)
 *   └──► ESCALATED (판정 시점에 미해결)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FindingStatus {

    OPEN,

    FIXED,

    DEFERRED_PROPOSED,

    DEFERRED_ACCEPTED,

    ESCALATED;

    /**
     * 해결 상태인지 확인 (FIXED, DEFERRED_ACCEPTED).
     *
     * @return 해결 상태이면 true
     */
    public boolean isResolved() {
        return this == FIXED || this == DEFERRED_ACCEPTED;
    }

    /**
     * 연기 사유가 반드시 있어야 하는 상태인지 확인.
     *
     * @return DEFERRED_PROPOSED, DEFERRED_ACCEPTED, ESCALATED이면 true
     */
    public boolean requiresJustification() {
        return this == DEFERRED_PROPOSED || this == DEFERRED_ACCEPTED || this == ESCALATED;
    }
}
