package com.ryuqq.devloop.application.orchestrator;

import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.Abandoned;
import com.ryuqq.devloop.core.outcome.Completed;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.outcome.Escalated;
import com.ryuqq.devloop.core.outcome.SessionOutcome;
import com.ryuqq.devloop.core.statemachine.Phase;

/**
 * 종료된 세션의 핸들.
 *
 * <p><strong>세 가지 가능한 결과:</strong></p>
 * <ul>
 *   <li>{@link Completed}: phase = COMPLETE</li>
 *   <li>{@link Abandoned}: phase = ABANDONED</li>
 *   <li>{@link Escalated}: phase = REVIEW (사람의 판단 대기)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionHandle {

    private final SessionId sessionId;
    private final Phase phase;
    private final SessionOutcome outcome;

    private SessionHandle(SessionId sessionId, Phase phase, SessionOutcome outcome) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        this.sessionId = sessionId;
        this.phase = phase;
        this.outcome = outcome;
    }

    /**
     * 결과로부터 핸들 생성.
     *
     * @param sessionId 세션 ID
     * @param phase 종료 시점 단계
     * @param outcome 결과
     * @return SessionHandle
     * @throws IllegalArgumentException 결과와 단계가 맞지 않는 경우
     */
    public static SessionHandle of(SessionId sessionId, Phase phase, SessionOutcome outcome) {
        if (outcome instanceof Completed && phase != Phase.COMPLETE) {
            throw new IllegalArgumentException("Completed outcome requires COMPLETE phase (current: " + phase + ")");
        }
        if (outcome instanceof Abandoned && phase != Phase.ABANDONED) {
            throw new IllegalArgumentException("Abandoned outcome requires ABANDONED phase (current: " + phase + ")");
        }
        if (outcome instanceof Escalated && phase.isTerminal()) {
            throw new IllegalArgumentException("Escalated outcome requires an active phase (current: " + phase + ")");
        }
        return new SessionHandle(sessionId, phase, outcome);
    }

    public SessionId getSessionId() {
        return sessionId;
    }

    public Phase getPhase() {
        return phase;
    }

    public SessionOutcome getOutcome() {
        return outcome;
    }

    public boolean isCompleted() {
        return outcome.isCompleted();
    }

    /**
     * 에스컬레이션 정보 조회.
     *
     * @return Abandoned/Escalated이면 보고서, Completed이면 null
     */
    public EscalationReport getEscalationOrNull() {
        if (outcome instanceof Abandoned abandoned) {
            return abandoned.escalation();
        }
        if (outcome instanceof Escalated escalated) {
            return escalated.escalation();
        }
        return null;
    }

    @Override
    public String toString() {
        return "SessionHandle{sessionId=" + sessionId + ", phase=" + phase + ", outcome=" + outcome + "}";
    }
}
