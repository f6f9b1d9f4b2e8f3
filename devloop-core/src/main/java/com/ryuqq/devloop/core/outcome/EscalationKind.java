package com.ryuqq.devloop.core.outcome;

/**
 * 에스컬레이션 원인 분류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EscalationKind {

    /** 게이트가 최대 라운드까지 충족되지 않음. */
    GATE_TIMEOUT,

    /** 검증이 최대 시도 횟수만큼 실패. */
    VALIDATION_FAILURE,

    /** 리뷰어와 구현자 사이의 미해결 이견. */
    REVIEW_ESCALATION,

    /** 리뷰 ↔ 구현 반복 한도 초과. */
    REVIEW_CYCLE_LIMIT,

    /** 세션 중단 (재시작으로 대체됨). */
    SESSION_INTERRUPTION
}
