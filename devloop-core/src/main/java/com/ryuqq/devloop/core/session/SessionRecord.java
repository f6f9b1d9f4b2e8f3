package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.statemachine.Phase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 영속화되는 세션 기록.
 *
 * <p>문자열, 숫자, 중첩 record만으로 구성되어 JSON으로 그대로 직렬화됩니다.
 * 세션 상태 조회, 중단된 세션 재시작, 롤백의 입력으로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionRecord(
    String sessionId,
    String task,
    String mode,
    String phase,
    String specialist,
    String startReference,
    String startBranch,
    Instant startMarkedAt,
    Instant createdAt,
    Instant updatedAt,
    String continuedFrom,
    int validationIterations,
    int consecutiveValidationFailures,
    int reviewCycles,
    int revision,
    List<RosterEntry> roster,
    List<GateRecord> gates,
    List<VerdictRecord> verdicts,
    List<FindingRecord> findings,
    List<String> validationHistory,
    List<AuditEntry> audit,
    String abandonReason,
    EscalationReport escalation
) {

    /**
     * 로스터 항목.
     *
     * @param name Actor 이름
     * @param role 역할
     * @param domain 리뷰 관점 (구현자는 null)
     * @param threshold 차단 임계값 (구현자는 null)
     * @param status 기록 시점 상태
     */
    public record RosterEntry(String name, String role, String domain, String threshold, String status) {
    }

    /**
     * 게이트 확인 테이블 항목.
     */
    public record GateRecord(String name, List<String> required, List<String> confirmed,
                             String status, int round, int maxRounds) {

        public GateRecord {
            required = required == null ? List.of() : List.copyOf(required);
            confirmed = confirmed == null ? List.of() : List.copyOf(confirmed);
        }
    }

    public record VerdictRecord(String reviewer, String stated, String effective, int revision, Instant at) {
    }

    public record FindingRecord(String id, String raisedBy, String description, String severity,
                                String status, String justification, Instant raisedAt, Instant updatedAt) {
    }

    public record AuditEntry(Instant at, String from, String to, String event) {
    }

    public SessionRecord {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("phase cannot be null or blank");
        }
        roster = roster == null ? List.of() : List.copyOf(roster);
        gates = gates == null ? List.of() : List.copyOf(gates);
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
        findings = findings == null ? List.of() : List.copyOf(findings);
        validationHistory = validationHistory == null ? List.of() : List.copyOf(validationHistory);
        audit = audit == null ? List.of() : List.copyOf(audit);
    }

    public Phase phaseValue() {
        return Phase.valueOf(phase);
    }

    /**
     * 종료 단계(COMPLETE, ABANDONED)에 도달했는지 확인.
     *
     * @return 종료되었으면 true
     */
    public boolean hasEnded() {
        return phaseValue().isTerminal();
    }

    public StartMarker toStartMarker() {
        return new StartMarker(startReference, startBranch, startMarkedAt);
    }

    /**
     * 중단된 세션을 ABANDONED로 보관한 사본.
     *
     * @param reason 중단 사유
     * @param escalationReport 에스컬레이션 정보
     * @param at 보관 시각
     * @return 새 SessionRecord
     * @throws IllegalStateException 이미 종료된 세션인 경우
     */
    public SessionRecord archivedAsAbandoned(String reason, EscalationReport escalationReport, Instant at) {
        if (hasEnded()) {
            throw new IllegalStateException("Session " + sessionId + " already ended in " + phase);
        }
        List<AuditEntry> trail = new ArrayList<>(audit);
        trail.add(new AuditEntry(at, phase, Phase.ABANDONED.name(), reason));
        return new SessionRecord(sessionId, task, mode, Phase.ABANDONED.name(), specialist,
            startReference, startBranch, startMarkedAt, createdAt, at, continuedFrom,
            validationIterations, consecutiveValidationFailures, reviewCycles, revision,
            roster, gates, verdicts, findings, validationHistory, trail, reason, escalationReport);
    }
}
