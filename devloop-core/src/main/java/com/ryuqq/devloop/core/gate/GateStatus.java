package com.ryuqq.devloop.core.gate;

/**
 * 게이트 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum GateStatus {

    /** 확인 대기 중. */
    OPEN,

    /** 모든 필수 참여자 확인 완료. 이후 되돌아가지 않음. */
    SATISFIED,

    /** 현재 라운드 제한 시간 초과. */
    TIMED_OUT
}
