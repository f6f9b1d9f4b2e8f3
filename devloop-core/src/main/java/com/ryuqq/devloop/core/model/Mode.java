package com.ryuqq.devloop.core.model;

/**
 * 세션 실행 모드.
 *
 * <ul>
 *   <li>FULL: 전체 파이프라인 (planning, reflection 포함)</li>
 *   <li>LIGHTWEIGHT: planning, reflection 생략. 민감 영역을 건드리는 변경에는 허용되지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Mode {

    FULL,

    LIGHTWEIGHT;

    public boolean skipsPlanning() {
        return this == LIGHTWEIGHT;
    }

    public boolean skipsReflection() {
        return this == LIGHTWEIGHT;
    }
}
