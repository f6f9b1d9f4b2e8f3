package com.ryuqq.devloop.core.outcome;

import java.util.List;
import java.util.Map;

/**
 * 완료된 세션의 인계용 요약.
 *
 * @param title 제목 (한 줄)
 * @param task 작업 설명
 * @param mode 실행 모드
 * @param specialist 구현 specialist
 * @param verdicts 리뷰어별 판정
 * @param technicalDebt 기술 부채로 남은 Finding 요약
 * @param validationIterations 검증 실행 횟수
 * @param reviewCycles 리뷰 반려 횟수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompletionSummary(
    String title,
    String task,
    String mode,
    String specialist,
    Map<String, String> verdicts,
    List<String> technicalDebt,
    int validationIterations,
    int reviewCycles
) {

    public CompletionSummary {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        verdicts = verdicts == null ? Map.of() : Map.copyOf(verdicts);
        technicalDebt = technicalDebt == null ? List.of() : List.copyOf(technicalDebt);
    }
}
