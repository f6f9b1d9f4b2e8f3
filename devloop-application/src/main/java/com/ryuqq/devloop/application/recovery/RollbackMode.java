package com.ryuqq.devloop.application.recovery;

/**
 * 롤백 방식.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RollbackMode {

    /** 시작 마커 대비 변경만 조회. 작업 트리는 그대로. */
    INSPECT,

    /** 시작 마커 상태로 되돌리되 작업은 검토용으로 보존. */
    SOFT,

    /** 시작 마커 상태로 완전히 되돌림. 작업은 폐기. */
    HARD
}
