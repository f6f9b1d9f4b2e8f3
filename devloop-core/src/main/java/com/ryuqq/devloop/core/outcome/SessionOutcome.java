package com.ryuqq.devloop.core.outcome;

/**
 * 세션 종료 결과.
 *
 * <ul>
 *   <li>{@link Completed}: 모든 게이트 통과, COMPLETE</li>
 *   <li>{@link Abandoned}: 한도 초과 또는 판정에 의해 ABANDONED</li>
 *   <li>{@link Escalated}: 사람의 판단 대기 (세션은 REVIEW에서 정지)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface SessionOutcome permits Completed, Abandoned, Escalated {

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isAbandoned() {
        return this instanceof Abandoned;
    }

    default boolean isEscalated() {
        return this instanceof Escalated;
    }
}
