package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.actor.ActorRole;
import com.ryuqq.devloop.core.actor.ActorSpec;
import com.ryuqq.devloop.core.actor.ActorStatus;
import com.ryuqq.devloop.core.check.ValidationRun;
import com.ryuqq.devloop.core.finding.Finding;
import com.ryuqq.devloop.core.finding.FindingLedger;
import com.ryuqq.devloop.core.finding.Verdict;
import com.ryuqq.devloop.core.gate.Gate;
import com.ryuqq.devloop.core.gate.GateStatus;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.Mode;
import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.outcome.EscalationReport;
import com.ryuqq.devloop.core.statemachine.AuditRecord;
import com.ryuqq.devloop.core.statemachine.Phase;
import com.ryuqq.devloop.core.statemachine.PhaseTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 하나의 변경 요청에 대한 세션 애그리거트.
 *
 * <p>Orchestrator 스레드만 이 객체를 변경합니다. Actor는 메시지만 보내며 세션에 직접 접근하지 않습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>단계 전이 검증 및 감사 기록</li>
 *   <li>로스터 (구현자 1명, 리뷰어 1명 이상)</li>
 *   <li>검증 이력, 반복 횟수, 변경 리비전</li>
 *   <li>Finding 원장과 리뷰어 판정 테이블</li>
 *   <li>게이트 확인 테이블</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Session {

    private final SessionId id;
    private final String task;
    private final String specialist;
    private final StartMarker startMarker;
    private final SessionId continuedFrom;
    private final Instant createdAt;
    private final Clock clock;
    private final Map<ActorName, ActorSpec> roster;
    private final ActorName implementer;
    private final FindingLedger ledger;
    private final List<AuditRecord> audit = new ArrayList<>();
    private final List<ValidationRun> validationRuns = new ArrayList<>();
    private final Map<ActorName, VerdictEntry> verdicts = new LinkedHashMap<>();
    private final Set<ActorName> reopenedVerdicts = new LinkedHashSet<>();
    private final List<SessionRecord.GateRecord> gates = new ArrayList<>();

    private Mode mode;
    private Phase phase;
    private Instant updatedAt;
    private int consecutiveValidationFailures;
    private int reviewCycles;
    private int revision;
    private String abandonReason;
    private EscalationReport escalation;

    private Session(SessionId id, String task, Mode mode, String specialist, Collection<ActorSpec> roster,
                    StartMarker startMarker, SessionId continuedFrom, Clock clock) {
        this.id = id;
        this.task = task;
        this.mode = mode;
        this.specialist = specialist;
        this.startMarker = startMarker;
        this.continuedFrom = continuedFrom;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.phase = Phase.SETUP;
        this.ledger = new FindingLedger(clock);
        this.roster = new LinkedHashMap<>();
        ActorName implementerName = null;
        for (ActorSpec spec : roster) {
            if (this.roster.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate actor name in roster: " + spec.name());
            }
            if (spec.role() == ActorRole.IMPLEMENTER) {
                if (implementerName != null) {
                    throw new IllegalArgumentException("Roster must have exactly one implementer (found "
                        + implementerName + " and " + spec.name() + ")");
                }
                implementerName = spec.name();
            }
        }
        if (implementerName == null) {
            throw new IllegalArgumentException("Roster must have exactly one implementer");
        }
        if (this.roster.size() < 2) {
            throw new IllegalArgumentException("Roster must have at least one reviewer");
        }
        this.implementer = implementerName;
    }

    /**
     * 세션 생성 (SETUP 단계).
     *
     * @param id 세션 ID
     * @param task 작업 설명
     * @param mode 실행 모드
     * @param specialist 구현 specialist
     * @param roster 로스터
     * @param startMarker 시작 마커
     * @param continuedFrom 이어받은 이전 세션 (없으면 null)
     * @param clock 시계
     * @return 새 세션
     */
    public static Session create(SessionId id, String task, Mode mode, String specialist,
                                 Collection<ActorSpec> roster, StartMarker startMarker,
                                 SessionId continuedFrom, Clock clock) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task cannot be null or blank");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (specialist == null || specialist.isBlank()) {
            throw new IllegalArgumentException("specialist cannot be null or blank");
        }
        if (roster == null) {
            throw new IllegalArgumentException("roster cannot be null");
        }
        if (startMarker == null) {
            throw new IllegalArgumentException("startMarker cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Session session = new Session(id, task, mode, specialist, roster, startMarker, continuedFrom, clock);
        session.note("Session created (mode=" + mode + ", specialist=" + specialist
            + (continuedFrom != null ? ", continues " + continuedFrom.getValue() : "") + ")");
        return session;
    }

    // ============================================================
    // Phase
    // ============================================================

    /**
     * 단계 전이.
     *
     * @param next 다음 단계
     * @param trigger 전이 원인
     * @return 기록된 감사 항목
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public AuditRecord transitionTo(Phase next, String trigger) {
        Phase previous = phase;
        phase = PhaseTransition.transition(previous, next, mode);
        AuditRecord record = AuditRecord.transition(touch(), previous, next, trigger);
        audit.add(record);
        return record;
    }

    /**
     * 세션 중단.
     *
     * @param reason 중단 사유
     * @param report 에스컬레이션 정보
     * @return 중단 직전 단계
     */
    public Phase abandon(String reason, EscalationReport report) {
        Phase lastKnownGood = phase;
        transitionTo(Phase.ABANDONED, reason);
        this.abandonReason = reason;
        this.escalation = report;
        return lastKnownGood;
    }

    /**
     * 사람의 판단을 기다리는 에스컬레이션 기록 (단계는 유지).
     *
     * @param report 에스컬레이션 정보
     */
    public void escalate(EscalationReport report) {
        this.escalation = report;
        note("Escalated to a human: " + report.summary());
    }

    /**
     * LIGHTWEIGHT에서 FULL로 전환.
     *
     * @param reason 감사 기록에 남길 사유
     */
    public void upgradeToFull(String reason) {
        if (mode == Mode.FULL) {
            return;
        }
        mode = Mode.FULL;
        note(reason);
    }

    public AuditRecord note(String event) {
        AuditRecord record = AuditRecord.note(touch(), phase, event);
        audit.add(record);
        return record;
    }

    // ============================================================
    // Validation
    // ============================================================

    public int nextValidationIteration() {
        return validationRuns.size() + 1;
    }

    /**
     * 검증 결과 기록.
     *
     * @param run 검증 실행
     * @return 연속 실패 횟수
     */
    public int recordValidationRun(ValidationRun run) {
        validationRuns.add(run);
        consecutiveValidationFailures = run.passed() ? 0 : consecutiveValidationFailures + 1;
        touch();
        return consecutiveValidationFailures;
    }

    public Optional<ValidationRun> latestValidationRun() {
        return validationRuns.isEmpty()
            ? Optional.empty()
            : Optional.of(validationRuns.get(validationRuns.size() - 1));
    }

    // ============================================================
    // Review
    // ============================================================

    /**
     * 변경 리비전 증가 (구현 완료, Finding 수정 시).
     *
     * @return 새 리비전
     */
    public int bumpRevision() {
        touch();
        return ++revision;
    }

    /**
     * 리뷰어 판정 기록. 원장 판정과 비교해 더 엄격한 쪽을 적용합니다.
     *
     * @param reviewer 리뷰어
     * @param stated 리뷰어가 보낸 판정
     * @return 기록된 판정
     */
    public VerdictEntry recordVerdict(ActorName reviewer, Verdict stated) {
        ActorSpec spec = reviewerSpec(reviewer);
        ledger.settle(reviewer, spec.policy());
        Verdict derived = ledger.verdictFor(reviewer);
        VerdictEntry entry = new VerdictEntry(reviewer, stated, Verdict.stricter(stated, derived), revision, touch());
        verdicts.put(reviewer, entry);
        reopenedVerdicts.remove(reviewer);
        return entry;
    }

    /**
     * 판정 이후 변경이 발생한 리뷰어.
     *
     * @return stale 판정을 가진 리뷰어
     */
    public List<ActorName> staleReviewers() {
        return verdicts.values().stream()
            .filter(entry -> entry.revision() < revision || reopenedVerdicts.contains(entry.reviewer()))
            .map(VerdictEntry::reviewer)
            .toList();
    }

    /**
     * 리비전과 무관하게 리뷰어의 판정을 stale로 표시 (판정 후 새 Finding을 올린 경우).
     *
     * @param reviewer 리뷰어
     * @throws IllegalArgumentException 판정을 보낸 적 없는 리뷰어인 경우
     */
    public void markVerdictStale(ActorName reviewer) {
        if (!verdicts.containsKey(reviewer)) {
            throw new IllegalArgumentException("No verdict recorded for " + reviewer);
        }
        reopenedVerdicts.add(reviewer);
        touch();
    }

    public List<VerdictEntry> escalatedVerdicts() {
        return verdicts.values().stream()
            .filter(entry -> !entry.effective().allowsAdvance())
            .toList();
    }

    public void clearVerdicts() {
        verdicts.clear();
        reopenedVerdicts.clear();
        touch();
    }

    public int incrementReviewCycles() {
        touch();
        return ++reviewCycles;
    }

    // ============================================================
    // Gates
    // ============================================================

    /**
     * 게이트 종료 시 확인 테이블 기록.
     *
     * @param gate 게이트
     * @param status 최종 상태
     */
    public void recordGate(Gate gate, GateStatus status) {
        gates.add(new SessionRecord.GateRecord(
            gate.name(),
            gate.required().stream().map(ActorName::getValue).sorted().toList(),
            gate.confirmed().stream().map(ActorName::getValue).toList(),
            status.name(),
            gate.round(),
            gate.maxRounds()
        ));
        touch();
    }

    // ============================================================
    // Roster
    // ============================================================

    public ActorName implementer() {
        return implementer;
    }

    public List<ActorName> reviewers() {
        return roster.values().stream()
            .filter(ActorSpec::isReviewer)
            .map(ActorSpec::name)
            .toList();
    }

    public List<ActorName> participants() {
        return List.copyOf(roster.keySet());
    }

    public List<ActorSpec> roster() {
        return List.copyOf(roster.values());
    }

    public boolean isReviewer(ActorName name) {
        ActorSpec spec = roster.get(name);
        return spec != null && spec.isReviewer();
    }

    public ActorSpec reviewerSpec(ActorName reviewer) {
        ActorSpec spec = roster.get(reviewer);
        if (spec == null || !spec.isReviewer()) {
            throw new IllegalArgumentException(reviewer + " is not a reviewer in session " + id.getValue());
        }
        return spec;
    }

    // ============================================================
    // Record
    // ============================================================

    /**
     * 영속화용 기록 생성.
     *
     * @param statuses 기록 시점의 Actor 상태 (없는 Actor는 STOPPED)
     * @return SessionRecord
     */
    public SessionRecord toRecord(Map<ActorName, ActorStatus> statuses) {
        List<SessionRecord.RosterEntry> rosterEntries = roster.values().stream()
            .map(spec -> new SessionRecord.RosterEntry(
                spec.name().getValue(),
                spec.role().name(),
                spec.domain() == null ? null : spec.domain().name(),
                spec.policy() == null ? null : spec.policy().threshold().name(),
                statuses.getOrDefault(spec.name(), ActorStatus.STOPPED).name()))
            .toList();
        List<SessionRecord.VerdictRecord> verdictRecords = verdicts.values().stream()
            .map(entry -> new SessionRecord.VerdictRecord(entry.reviewer().getValue(), entry.stated().name(),
                entry.effective().name(), entry.revision(), entry.at()))
            .toList();
        List<SessionRecord.FindingRecord> findingRecords = ledger.all().stream()
            .map(Session::toRecord)
            .toList();
        List<SessionRecord.AuditEntry> auditEntries = audit.stream()
            .map(record -> new SessionRecord.AuditEntry(record.at(), record.from().name(), record.to().name(),
                record.event()))
            .toList();

        return new SessionRecord(
            id.getValue(), task, mode.name(), phase.name(), specialist,
            startMarker.reference(), startMarker.branch(), startMarker.markedAt(),
            createdAt, updatedAt, continuedFrom == null ? null : continuedFrom.getValue(),
            validationRuns.size(), consecutiveValidationFailures, reviewCycles, revision,
            rosterEntries, gates, verdictRecords, findingRecords,
            validationRuns.stream().map(ValidationRun::summary).toList(),
            auditEntries, abandonReason, escalation
        );
    }

    private static SessionRecord.FindingRecord toRecord(Finding finding) {
        return new SessionRecord.FindingRecord(finding.id().getValue(), finding.raisedBy().getValue(),
            finding.description(), finding.severity().name(), finding.status().name(), finding.justification(),
            finding.raisedAt(), finding.updatedAt());
    }

    private Instant touch() {
        updatedAt = clock.instant();
        return updatedAt;
    }

    // ============================================================
    // Getters
    // ============================================================

    public SessionId id() {
        return id;
    }

    public String task() {
        return task;
    }

    public Mode mode() {
        return mode;
    }

    public Phase phase() {
        return phase;
    }

    public String specialist() {
        return specialist;
    }

    public StartMarker startMarker() {
        return startMarker;
    }

    public FindingLedger ledger() {
        return ledger;
    }

    public List<AuditRecord> audit() {
        return List.copyOf(audit);
    }

    public List<ValidationRun> validationRuns() {
        return List.copyOf(validationRuns);
    }

    public Map<ActorName, VerdictEntry> verdicts() {
        return Map.copyOf(verdicts);
    }

    public int consecutiveValidationFailures() {
        return consecutiveValidationFailures;
    }

    public int reviewCycles() {
        return reviewCycles;
    }

    public int revision() {
        return revision;
    }

    public EscalationReport escalation() {
        return escalation;
    }

    public Instant updatedAt() {
        return updatedAt;
    }
}
