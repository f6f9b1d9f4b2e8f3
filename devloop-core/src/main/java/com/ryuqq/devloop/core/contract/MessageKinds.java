package com.ryuqq.devloop.core.contract;

/**
 * 메시지 종류 상수.
 *
 * <p>방향 표기: {@code orch} = Orchestrator, {@code impl} = 구현자, {@code rev} = 리뷰어.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageKinds {

    private MessageKinds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ===== Setup / Planning =====

    /** orch → impl. 작업 배정. body=task */
    public static final String TASK_ASSIGNED = "task.assigned";

    /** impl → orch. 계획 초안. body=plan */
    public static final String PLAN_DRAFTED = "plan.drafted";

    /** orch → rev. 계획 검토 요청. body=plan */
    public static final String PLAN_REVIEW_REQUESTED = "plan.review_requested";

    /** rev → orch. 계획 확인 (planning 게이트 충족 조건). */
    public static final String PLAN_CONFIRMED = "plan.confirmed";

    /** orch → impl. 계획 승인, 구현 시작. */
    public static final String PLAN_APPROVED = "plan.approved";

    // ===== Implementation / Validation =====

    /** impl → orch. 구현 완료 (implementation 게이트 충족 조건). */
    public static final String IMPLEMENTATION_READY = "implementation.ready";

    /** orch → impl. 검증 실패 피드백. attrs: layer, iteration */
    public static final String VALIDATION_FAILED = "validation.failed";

    // ===== Review =====

    /** orch → rev. 리뷰 요청. body=diff, attrs: revision, implementer */
    public static final String REVIEW_REQUESTED = "review.requested";

    /** rev → orch. Finding 제기. body=description, attrs: severity */
    public static final String FINDING_RAISED = "finding.raised";

    /** orch → impl. Finding 전달. attrs: findingId, severity, raisedBy */
    public static final String FINDING_OPENED = "finding.opened";

    /** impl → orch. Finding 수정 완료. attrs: findingId */
    public static final String FINDING_FIXED = "finding.fixed";

    /** orch → rev. 수정 확인 요청. attrs: findingId, revision */
    public static final String FIX_SUBMITTED = "finding.fix_submitted";

    /** impl → orch. 연기 제안. body=justification, attrs: findingId */
    public static final String DEFERRAL_PROPOSED = "deferral.proposed";

    /** orch → rev. 연기 판단 요청. body=justification, attrs: findingId, category */
    public static final String DEFERRAL_REVIEW_REQUESTED = "deferral.review_requested";

    /** rev → orch. 연기 수락. attrs: findingId */
    public static final String DEFERRAL_ACCEPTED = "deferral.accepted";

    /** rev → orch. 연기 거절. attrs: findingId */
    public static final String DEFERRAL_REJECTED = "deferral.rejected";

    /** orch → impl. 연기 판단 결과. attrs: findingId, decision */
    public static final String DEFERRAL_DECIDED = "deferral.decided";

    /** rev → orch. 최종 판정 (review 게이트 충족 조건). attrs: verdict */
    public static final String VERDICT = "verdict";

    /** orch → rev. 판정 이후 변경 발생, 재판정 요청. body=diff, attrs: revision */
    public static final String REVERDICT_REQUESTED = "review.reverdict_requested";

    /** orch → impl. 에스컬레이션 후 구현 단계로 반려. body=escalated findings */
    public static final String CHANGES_REQUESTED = "review.changes_requested";

    // ===== Reflection / Close =====

    /** orch → all. 회고 요청. */
    public static final String REFLECTION_REQUESTED = "reflection.requested";

    /** any → orch. 회고 완료 (reflection 게이트 충족 조건). body=learnings */
    public static final String REFLECTION_DONE = "reflection.done";

    /** orch → all. 세션 종료 통지. attrs: phase */
    public static final String SESSION_CLOSED = "session.closed";

    /** actor ↔ actor. 자유 형식 토론. */
    public static final String DISCUSSION = "discussion";

    // ===== Attribute keys =====

    public static final String ATTR_FINDING_ID = "findingId";
    public static final String ATTR_SEVERITY = "severity";
    public static final String ATTR_RAISED_BY = "raisedBy";
    public static final String ATTR_VERDICT = "verdict";
    public static final String ATTR_REVISION = "revision";
    public static final String ATTR_LAYER = "layer";
    public static final String ATTR_ITERATION = "iteration";
    public static final String ATTR_IMPLEMENTER = "implementer";
    public static final String ATTR_SPECIALIST = "specialist";
    public static final String ATTR_MODE = "mode";
    public static final String ATTR_CATEGORY = "category";
    public static final String ATTR_DECISION = "decision";
    public static final String ATTR_PHASE = "phase";

    /** Orchestrator가 붙이고, Actor 컨텍스트가 응답 메시지로 전파합니다. */
    public static final String ATTR_SESSION_ID = "sessionId";
}
