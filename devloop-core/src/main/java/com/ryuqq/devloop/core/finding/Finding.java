package com.ryuqq.devloop.core.finding;

import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.model.FindingId;

import java.time.Instant;

/**
 * 리뷰어가 제기한 문제 하나.
 *
 * <p>불변 객체이며, 상태 변경 메서드는 {@link FindingTransition}으로 검증한 뒤 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>불변식:</strong> 연기 사유는 상태가 DEFERRED_PROPOSED, DEFERRED_ACCEPTED,
 * ESCALATED일 때만 존재합니다.</p>
 *
 * @param id Finding ID
 * @param raisedBy 제기한 리뷰어
 * @param description 설명
 * @param severity 심각도
 * @param status 상태
 * @param justification 연기 사유 (해당 상태에서만 non-null)
 * @param raisedAt 제기 시각
 * @param updatedAt 최종 변경 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Finding(
    FindingId id,
    ActorName raisedBy,
    String description,
    Severity severity,
    FindingStatus status,
    String justification,
    Instant raisedAt,
    Instant updatedAt
) {

    public Finding {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (raisedBy == null) {
            throw new IllegalArgumentException("raisedBy cannot be null");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (raisedAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        boolean hasJustification = justification != null && !justification.isBlank();
        if (status.requiresJustification() && !hasJustification) {
            throw new IllegalArgumentException("Finding " + id + " in status " + status + " requires a justification");
        }
        if (!status.requiresJustification() && justification != null) {
            throw new IllegalArgumentException("Finding " + id + " in status " + status + " cannot carry a justification");
        }
    }

    static Finding open(FindingId id, ActorName raisedBy, String description, Severity severity, Instant now) {
        return new Finding(id, raisedBy, description, severity, FindingStatus.OPEN, null, now, now);
    }

    Finding fixed(Instant now) {
        return moveTo(FindingStatus.FIXED, null, now);
    }

    Finding proposeDeferral(String reason, Instant now) {
        return moveTo(FindingStatus.DEFERRED_PROPOSED, reason, now);
    }

    Finding acceptDeferral(Instant now) {
        return moveTo(FindingStatus.DEFERRED_ACCEPTED, justification, now);
    }

    Finding acceptAs(String reason, Instant now) {
        return moveTo(FindingStatus.DEFERRED_ACCEPTED, reason, now);
    }

    Finding escalate(String reason, Instant now) {
        return moveTo(FindingStatus.ESCALATED, reason, now);
    }

    private Finding moveTo(FindingStatus next, String reason, Instant now) {
        FindingTransition.validate(status, next);
        return new Finding(id, raisedBy, description, severity, next, reason, raisedAt, now);
    }

    public boolean isResolved() {
        return status.isResolved();
    }
}
