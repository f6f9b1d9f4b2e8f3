package com.ryuqq.devloop.core.actor;

/**
 * Actor 실행 상태.
 *
 * <p>IDLE은 "메시지를 기다리는 중"이라는 뜻일 뿐, 작업 완료를 의미하지 않습니다.
 * 단계 진행은 오직 게이트 충족으로만 결정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ActorStatus {

    /** 메시지 처리 중. */
    ACTIVE,

    /** 다음 메시지 대기 중. */
    IDLE,

    /** 런타임 종료됨. */
    STOPPED
}
