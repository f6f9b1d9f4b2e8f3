package com.ryuqq.devloop.adapter.runner;

/**
 * 세션 목록 한 줄.
 *
 * @param sessionId 세션 ID
 * @param phase 현재 단계
 * @param specialist specialist
 * @param iteration 검증 반복 횟수
 * @param task 작업 설명 (60자 초과 시 "..."로 줄임)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionSummary(
    String sessionId,
    String phase,
    String specialist,
    int iteration,
    String task
) {
}
