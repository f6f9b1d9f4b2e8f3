package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.SessionStore;
import com.ryuqq.devloop.core.statemachine.Phase;

import java.util.List;

/**
 * 저장된 세션 목록 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionStatusQuery {

    static final int TASK_MAX_LENGTH = 60;

    /**
     * 조회 필터.
     */
    public enum Filter {
        ALL,
        /** 종료되지 않은 세션. */
        ACTIVE,
        /** COMPLETE 단계 세션. */
        COMPLETE
    }

    private final SessionStore store;

    public SessionStatusQuery(SessionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 최근 갱신 순 세션 목록.
     *
     * @param filter 필터
     * @return 요약 목록
     */
    public List<SessionSummary> list(Filter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        return store.list().stream()
            .filter(record -> matches(record, filter))
            .map(SessionStatusQuery::summarize)
            .toList();
    }

    private static boolean matches(SessionRecord record, Filter filter) {
        return switch (filter) {
            case ALL -> true;
            case ACTIVE -> !record.hasEnded();
            case COMPLETE -> record.phaseValue() == Phase.COMPLETE;
        };
    }

    private static SessionSummary summarize(SessionRecord record) {
        return new SessionSummary(record.sessionId(), record.phase(), record.specialist(),
            record.validationIterations(), truncate(record.task()));
    }

    static String truncate(String task) {
        if (task == null || task.length() <= TASK_MAX_LENGTH) {
            return task;
        }
        return task.substring(0, TASK_MAX_LENGTH - 3) + "...";
    }
}
