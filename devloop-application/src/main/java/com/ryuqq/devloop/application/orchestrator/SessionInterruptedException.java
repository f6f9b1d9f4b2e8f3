package com.ryuqq.devloop.application.orchestrator;

import com.ryuqq.devloop.core.model.SessionId;

/**
 * 세션 실행 중 오케스트레이터 스레드가 인터럽트되었을 때 발생.
 *
 * <p>세션 기록은 마지막으로 저장된 단계에 남아 있으며,
 * {@link StartRequest#continuing(SessionId, com.ryuqq.devloop.core.model.Mode)}로 이어서 시작할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionInterruptedException extends RuntimeException {

    private final SessionId sessionId;

    public SessionInterruptedException(SessionId sessionId, Throwable cause) {
        super("Session " + sessionId.getValue() + " was interrupted", cause);
        this.sessionId = sessionId;
    }

    public SessionId getSessionId() {
        return sessionId;
    }
}
