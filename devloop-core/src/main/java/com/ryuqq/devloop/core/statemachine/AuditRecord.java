package com.ryuqq.devloop.core.statemachine;

import java.time.Instant;

/**
 * 세션 감사 기록 한 건.
 *
 * <p>단계 전이뿐 아니라 게이트 연장, 모드 전환 같은 이벤트도 기록합니다.
 * 이벤트 기록은 {@code from == to}입니다.</p>
 *
 * @param at 기록 시각
 * @param from 이전 단계
 * @param to 이후 단계
 * @param event 원인 또는 이벤트 설명
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AuditRecord(
    Instant at,
    Phase from,
    Phase to,
    String event
) {

    public AuditRecord {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("phases cannot be null");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
    }

    public static AuditRecord transition(Instant at, Phase from, Phase to, String trigger) {
        return new AuditRecord(at, from, to, trigger);
    }

    public static AuditRecord note(Instant at, Phase phase, String event) {
        return new AuditRecord(at, phase, phase, event);
    }

    public boolean isTransition() {
        return from != to;
    }
}
