package com.ryuqq.devloop.core.actor;

import com.ryuqq.devloop.core.finding.BlockingPolicy;
import com.ryuqq.devloop.core.finding.Severity;

/**
 * 리뷰어의 검토 관점과 기본 차단 정책.
 *
 * <p><strong>기본 차단 임계값:</strong></p>
 * <ul>
 *   <li>SECURITY, TEST: 모든 Finding이 차단 (LOW 이상)</li>
 *   <li>CODE_QUALITY: MEDIUM 이상 차단</li>
 *   <li>DRY, OPERATIONS: CRITICAL만 차단, 나머지는 기술 부채로 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReviewerDomain {

    SECURITY(Severity.LOW),

    TEST(Severity.LOW),

    CODE_QUALITY(Severity.MEDIUM),

    DRY(Severity.CRITICAL),

    OPERATIONS(Severity.CRITICAL);

    private final Severity defaultThreshold;

    ReviewerDomain(Severity defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public BlockingPolicy defaultPolicy() {
        return BlockingPolicy.atLeast(defaultThreshold);
    }
}
