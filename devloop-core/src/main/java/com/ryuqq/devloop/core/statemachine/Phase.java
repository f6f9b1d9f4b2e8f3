package com.ryuqq.devloop.core.statemachine;

/**
 * 세션 생명주기 단계.
 *
 * <p><strong>단계 전이 다이어그램:</strong></p>
 * <pre>
 * SETUP
 *   │ (FULL)                 (LIGHTWEIGHT)
 *   ▼                              │
 * PLANNING ──► IMPLEMENTATION ◄────┘
 *                 │    ▲
 *                 ▼    │ (검증 실패 / 리뷰 반려)
 *              VALIDATION
 *                 │
 *                 ▼
 *               REVIEW ──► REFLECTION ──► COMPLETE
 *                 │    (LIGHTWEIGHT)         ▲
 *                 └──────────────────────────┘
 *
 * 모든 비종료 단계 ──► ABANDONED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Phase {

    /** 세션 생성, 로스터 구성. */
    SETUP,

    /** 계획 수립 및 리뷰어 확인 (FULL 전용). */
    PLANNING,

    /** 구현 중. */
    IMPLEMENTATION,

    /** 계층형 자동 검증. */
    VALIDATION,

    /** 리뷰어 검토. */
    REVIEW,

    /** 회고 (FULL 전용). */
    REFLECTION,

    /** 완료. */
    COMPLETE,

    /** 중단. */
    ABANDONED;

    /**
     * 종료 단계인지 확인.
     *
     * @return COMPLETE 또는 ABANDONED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ABANDONED;
    }
}
