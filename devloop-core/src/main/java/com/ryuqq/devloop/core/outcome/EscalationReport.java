package com.ryuqq.devloop.core.outcome;

import java.util.List;

/**
 * 사람에게 전달하는 구조화된 에스컬레이션 정보.
 *
 * <p>세션이 중단되거나 사람의 판단을 기다릴 때 항상 함께 기록됩니다.</p>
 *
 * @param kind 원인 분류
 * @param summary 한 줄 요약
 * @param currentFailures 현재 실패 내용
 * @param attemptHistory 지금까지의 시도 이력
 * @param suggestedActions 권장 조치
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EscalationReport(
    EscalationKind kind,
    String summary,
    List<String> currentFailures,
    List<String> attemptHistory,
    List<String> suggestedActions
) {

    public EscalationReport {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary cannot be null or blank");
        }
        currentFailures = currentFailures == null ? List.of() : List.copyOf(currentFailures);
        attemptHistory = attemptHistory == null ? List.of() : List.copyOf(attemptHistory);
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
