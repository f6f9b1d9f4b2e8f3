package com.ryuqq.devloop.core.check;

import java.time.Duration;

/**
 * 검증 계층 하나의 결과.
 *
 * @param name 계층 이름
 * @param outcome 결과
 * @param output 출력 (SKIPPED는 빈 문자열)
 * @param hint 실패 시 조치 힌트
 * @param elapsed 실행 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LayerResult(
    String name,
    LayerOutcome outcome,
    String output,
    String hint,
    Duration elapsed
) {

    public LayerResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        output = output == null ? "" : output;
        hint = hint == null ? "" : hint;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static LayerResult skipped(String name) {
        return new LayerResult(name, LayerOutcome.SKIPPED, "", "", Duration.ZERO);
    }
}
