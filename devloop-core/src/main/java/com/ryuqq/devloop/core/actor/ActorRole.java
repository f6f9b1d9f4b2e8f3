package com.ryuqq.devloop.core.actor;

/**
 * 세션 내 Actor 역할.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ActorRole {

    /** 코드를 작성하는 구현자 (세션당 1명). */
    IMPLEMENTER,

    /** 특정 관점에서 변경을 검토하는 리뷰어. */
    REVIEWER
}
