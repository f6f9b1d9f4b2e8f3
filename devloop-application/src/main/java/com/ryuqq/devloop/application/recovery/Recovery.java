package com.ryuqq.devloop.application.recovery;

import com.ryuqq.devloop.core.model.SessionId;

/**
 * 중단되었거나 종료된 세션의 작업 트리 복구.
 *
 * <p>세션 기록의 시작 마커를 기준으로 변경을 조회하거나 되돌립니다.
 * 진행 중인 세션에는 롤백할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Recovery {

    /**
     * 롤백 실행.
     *
     * @param sessionId 세션
     * @param mode 롤백 방식
     * @return 결과
     * @throws IllegalArgumentException 세션 기록이 없는 경우
     * @throws IllegalStateException 세션이 진행 중인 경우 (INSPECT 제외)
     */
    RollbackResult rollback(SessionId sessionId, RollbackMode mode);
}
