package com.ryuqq.devloop.core.finding;

/**
 * 리뷰어별 차단 정책.
 *
 * <p>임계값 이상의 Finding은 수정되거나 연기가 수락되어야 합니다.
 * 임계값 미만의 Finding은 판정 시점에 기술 부채로 자동 기록됩니다.</p>
 *
 * @param threshold 차단 임계 심각도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BlockingPolicy(Severity threshold) {

    public BlockingPolicy {
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
    }

    public static BlockingPolicy atLeast(Severity threshold) {
        return new BlockingPolicy(threshold);
    }

    /** 모든 Finding이 차단. */
    public static BlockingPolicy anyFinding() {
        return new BlockingPolicy(Severity.LOW);
    }

    /** CRITICAL만 차단. */
    public static BlockingPolicy criticalOnly() {
        return new BlockingPolicy(Severity.CRITICAL);
    }

    public boolean blocks(Severity severity) {
        return severity.isAtLeast(threshold);
    }
}
