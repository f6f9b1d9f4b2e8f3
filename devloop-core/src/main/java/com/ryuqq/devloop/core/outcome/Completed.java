package com.ryuqq.devloop.core.outcome;

/**
 * 세션 완료.
 *
 * @param summary 완료 요약 (인계용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Completed(CompletionSummary summary) implements SessionOutcome {

    public Completed {
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
    }
}
