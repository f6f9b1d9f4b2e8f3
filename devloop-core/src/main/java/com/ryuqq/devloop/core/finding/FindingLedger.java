package com.ryuqq.devloop.core.finding;

import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.FindingId;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 세션의 Finding 원장.
 *
 * <p>Orchestrator 스레드 하나만 접근한다고 가정하며 동기화하지 않습니다.
 * Finding ID는 세션 내에서 1부터 순서대로 발급됩니다.</p>
 *
 * <p><strong>판정 정리 규칙 ({@link #settle}):</strong></p>
 * <ul>
 *   <li>임계값 미만 OPEN/DEFERRED_PROPOSED → DEFERRED_ACCEPTED (기술 부채)</li>
 *   <li>임계값 이상 OPEN → ESCALATED (판정 시점 미해결)</li>
 *   <li>임계값 이상 DEFERRED_PROPOSED → 유효 사유면 DEFERRED_ACCEPTED, 아니면 ESCALATED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FindingLedger {

    static final String TECHNICAL_DEBT_REASON = "Below blocking threshold; recorded as technical debt";
    static final String UNRESOLVED_REASON = "Unresolved at verdict: neither fixed nor deferred";

    private final Clock clock;
    private final Map<FindingId, Finding> findings = new LinkedHashMap<>();
    private int sequence;

    public FindingLedger(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    public Finding raise(ActorName raisedBy, String description, Severity severity) {
        FindingId id = FindingId.ofSequence(++sequence);
        Finding finding = Finding.open(id, raisedBy, description, severity, clock.instant());
        findings.put(id, finding);
        return finding;
    }

    public Finding markFixed(FindingId id) {
        return replace(get(id).fixed(clock.instant()));
    }

    public Finding proposeDeferral(FindingId id, String justification) {
        if (justification == null || justification.isBlank()) {
            throw new IllegalArgumentException("Deferral of " + id + " requires a justification");
        }
        return replace(get(id).proposeDeferral(justification, clock.instant()));
    }

    /**
     * 리뷰어의 연기 수락.
     *
     * <p>차단 대상 Finding의 사유가 유효 범주가 아니면 수락과 무관하게 ESCALATED가 됩니다.</p>
     *
     * @param id Finding ID
     * @param policy Finding을 올린 리뷰어의 차단 정책
     * @return 갱신된 Finding (DEFERRED_ACCEPTED 또는 ESCALATED)
     * @throws IllegalStateException DEFERRED_PROPOSED 상태가 아닌 경우
     */
    public Finding acceptDeferral(FindingId id, BlockingPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        Finding current = get(id);
        if (current.status() != FindingStatus.DEFERRED_PROPOSED) {
            throw new IllegalStateException("Finding " + id + " has no pending deferral (status: " + current.status() + ")");
        }
        if (policy.blocks(current.severity()) && !DeferralJustifications.isValid(current.justification())) {
            return replace(current.escalate(current.justification(), clock.instant()));
        }
        return replace(current.acceptDeferral(clock.instant()));
    }

    public Finding rejectDeferral(FindingId id) {
        Finding current = get(id);
        if (current.status() != FindingStatus.DEFERRED_PROPOSED) {
            throw new IllegalStateException("Finding " + id + " has no pending deferral (status: " + current.status() + ")");
        }
        return replace(current.escalate(current.justification(), clock.instant()));
    }

    /**
     * 판정 결과로 ESCALATED Finding을 수락 (리뷰어 판단 무시).
     *
     * @param id Finding ID
     * @param reason 수락 사유
     * @return 갱신된 Finding
     */
    public Finding overrideAccept(FindingId id, String reason) {
        Finding current = get(id);
        if (current.status() != FindingStatus.ESCALATED) {
            throw new IllegalStateException("Finding " + id + " is not escalated (status: " + current.status() + ")");
        }
        return replace(current.acceptAs(reason, clock.instant()));
    }

    /**
     * 리뷰어 판정 시점에 해당 리뷰어의 미해결 Finding 정리.
     *
     * @param reviewer 리뷰어
     * @param policy 리뷰어 차단 정책
     * @return 상태가 바뀐 Finding 목록
     */
    public List<Finding> settle(ActorName reviewer, BlockingPolicy policy) {
        List<Finding> changed = new ArrayList<>();
        for (Finding finding : raisedBy(reviewer)) {
            Finding next = settleOne(finding, policy);
            if (next != finding) {
                changed.add(replace(next));
            }
        }
        return changed;
    }

    private Finding settleOne(Finding finding, BlockingPolicy policy) {
        boolean blocking = policy.blocks(finding.severity());
        return switch (finding.status()) {
            case OPEN -> blocking
                ? finding.escalate(UNRESOLVED_REASON, clock.instant())
                : finding.acceptAs(TECHNICAL_DEBT_REASON, clock.instant());
            case DEFERRED_PROPOSED -> !blocking || DeferralJustifications.isValid(finding.justification())
                ? finding.acceptDeferral(clock.instant())
                : finding.escalate(finding.justification(), clock.instant());
            case FIXED, DEFERRED_ACCEPTED, ESCALATED -> finding;
        };
    }

    /**
     * 원장으로부터 리뷰어 판정 도출.
     *
     * @param reviewer 리뷰어
     * @return Finding이 없으면 CLEAR, 모두 해결이면 RESOLVED, 아니면 ESCALATED
     */
    public Verdict verdictFor(ActorName reviewer) {
        List<Finding> raised = raisedBy(reviewer);
        if (raised.isEmpty()) {
            return Verdict.CLEAR;
        }
        boolean allResolved = raised.stream().allMatch(Finding::isResolved);
        return allResolved ? Verdict.RESOLVED : Verdict.ESCALATED;
    }

    public Finding get(FindingId id) {
        Finding finding = findings.get(id);
        if (finding == null) {
            throw new NoSuchElementException("Unknown finding: " + id);
        }
        return finding;
    }

    public boolean contains(FindingId id) {
        return findings.containsKey(id);
    }

    public List<Finding> all() {
        return List.copyOf(findings.values());
    }

    public List<Finding> raisedBy(ActorName reviewer) {
        return findings.values().stream()
            .filter(f -> f.raisedBy().equals(reviewer))
            .toList();
    }

    public List<Finding> withStatus(FindingStatus status) {
        return findings.values().stream()
            .filter(f -> f.status() == status)
            .toList();
    }

    /**
     * 기술 부채로 남은 Finding (DEFERRED_ACCEPTED).
     *
     * @return 목록
     */
    public List<Finding> technicalDebt() {
        return withStatus(FindingStatus.DEFERRED_ACCEPTED);
    }

    private Finding replace(Finding next) {
        findings.put(next.id(), next);
        return next;
    }
}
