package com.ryuqq.devloop.application.recovery;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.model.StartMarker;

/**
 * 롤백 결과.
 *
 * @param sessionId 세션
 * @param mode 롤백 방식
 * @param marker 기준 시작 마커
 * @param before 롤백 전 변경
 * @param after 롤백 후 변경 (HARD이면 비어있음)
 * @param preservedAt SOFT 롤백 시 작업 보존 위치 (그 외 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RollbackResult(
    SessionId sessionId,
    RollbackMode mode,
    StartMarker marker,
    Change before,
    Change after,
    String preservedAt
) {

    public RollbackResult {
        if (sessionId == null || mode == null || marker == null || before == null || after == null) {
            throw new IllegalArgumentException("RollbackResult fields cannot be null");
        }
    }
}
