package com.ryuqq.devloop.core.check;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 검증 1회 실행 결과.
 *
 * @param iteration 세션 내 검증 회차 (1부터)
 * @param layers 계층별 결과 (실행 순서)
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationRun(
    int iteration,
    List<LayerResult> layers,
    Instant startedAt,
    Instant finishedAt
) {

    public ValidationRun {
        if (iteration <= 0) {
            throw new IllegalArgumentException("iteration must be positive (current: " + iteration + ")");
        }
        layers = List.copyOf(layers);
    }

    /**
     * 전체 결과. 실패한 계층이 하나라도 있으면 FAIL.
     *
     * @return PASS 또는 FAIL
     */
    public LayerOutcome overall() {
        return firstFailure().isPresent() ? LayerOutcome.FAIL : LayerOutcome.PASS;
    }

    public boolean passed() {
        return overall() == LayerOutcome.PASS;
    }

    public Optional<LayerResult> firstFailure() {
        return layers.stream()
            .filter(layer -> layer.outcome() == LayerOutcome.FAIL)
            .findFirst();
    }

    /**
     * 한 줄 요약 (예: "iteration 2: compile=PASS, tests=FAIL, lint=SKIPPED").
     *
     * @return 요약
     */
    public String summary() {
        return "iteration " + iteration + ": " + layers.stream()
            .map(layer -> layer.name() + "=" + layer.outcome())
            .collect(Collectors.joining(", "));
    }
}
