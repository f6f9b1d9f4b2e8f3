package com.ryuqq.devloop.core.check;

/**
 * 검증 수준.
 *
 * <ul>
 *   <li>QUICK: compile, static-guards</li>
 *   <li>STANDARD: QUICK + format, tests</li>
 *   <li>FULL: 모든 계층 (lint, dependency-audit, 산출물 기반 추가 검사 포함)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum VerificationLevel {

    QUICK,

    STANDARD,

    FULL;

    /**
     * 이 수준에서 해당 최소 수준의 검사를 실행하는지 확인.
     *
     * @param minimum 검사가 요구하는 최소 수준
     * @return 실행하면 true
     */
    public boolean includes(VerificationLevel minimum) {
        return compareTo(minimum) >= 0;
    }
}
