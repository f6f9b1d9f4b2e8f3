package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.core.check.VerificationLevel;

import java.time.Duration;

/**
 * SessionOrchestrator 설정 (불변 record).
 *
 * <p>세션의 모든 대기와 반복 횟수의 상한을 정의합니다. 상한을 넘으면 세션은
 * 구조화된 에스컬레이션 정보와 함께 중단(ABANDONED)됩니다.</p>
 *
 * <p><strong>설정 항목 (기본값):</strong></p>
 * <ul>
 *   <li>planningTimeout / planningRounds: 계획 확인 게이트 (30분, 3라운드)</li>
 *   <li>implementationTimeout / implementationRounds: 구현 완료 대기 (2시간, 3라운드)</li>
 *   <li>reviewTimeout / reviewRounds: 판정 게이트 (60분, 3라운드)</li>
 *   <li>reflectionTimeout / reflectionRounds: 회고 soft deadline (15분, 1라운드)</li>
 *   <li>maxValidationAttempts: 연속 검증 실패 허용 횟수 (3)</li>
 *   <li>maxReviewCycles: 리뷰 → 구현 되돌림 허용 횟수 (3)</li>
 *   <li>maxReverdictPasses: stale 판정 재요청 횟수 (3)</li>
 *   <li>pollInterval: 오케스트레이터 mailbox 대기 간격 (100ms)</li>
 *   <li>verificationLevel: 검증 계층 범위 (FULL)</li>
 *   <li>implementerName: 구현 Actor 이름 ("implementer")</li>
 *   <li>defaultSpecialist: 분류되지 않은 작업의 specialist ("general")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    Duration planningTimeout,
    int planningRounds,
    Duration implementationTimeout,
    int implementationRounds,
    Duration reviewTimeout,
    int reviewRounds,
    Duration reflectionTimeout,
    int reflectionRounds,
    int maxValidationAttempts,
    int maxReviewCycles,
    int maxReverdictPasses,
    Duration pollInterval,
    VerificationLevel verificationLevel,
    String implementerName,
    String defaultSpecialist
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(Duration.ofMinutes(30), 3,
            Duration.ofHours(2), 3,
            Duration.ofMinutes(60), 3,
            Duration.ofMinutes(15), 1,
            3, 3, 3,
            Duration.ofMillis(100),
            VerificationLevel.FULL,
            "implementer",
            "general");
    }

    public OrchestratorConfig {
        requirePositive("planningTimeout", planningTimeout);
        requirePositive("implementationTimeout", implementationTimeout);
        requirePositive("reviewTimeout", reviewTimeout);
        requirePositive("reflectionTimeout", reflectionTimeout);
        requirePositive("pollInterval", pollInterval);
        requirePositive("planningRounds", planningRounds);
        requirePositive("implementationRounds", implementationRounds);
        requirePositive("reviewRounds", reviewRounds);
        requirePositive("reflectionRounds", reflectionRounds);
        requirePositive("maxValidationAttempts", maxValidationAttempts);
        requirePositive("maxReviewCycles", maxReviewCycles);
        requirePositive("maxReverdictPasses", maxReverdictPasses);
        if (verificationLevel == null) {
            throw new IllegalArgumentException("verificationLevel cannot be null");
        }
        if (implementerName == null || implementerName.isBlank()) {
            throw new IllegalArgumentException("implementerName cannot be null or blank");
        }
        if (defaultSpecialist == null || defaultSpecialist.isBlank()) {
            throw new IllegalArgumentException("defaultSpecialist cannot be null or blank");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public OrchestratorConfig withPlanningGate(Duration timeout, int rounds) {
        return new OrchestratorConfig(timeout, rounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withImplementationGate(Duration timeout, int rounds) {
        return new OrchestratorConfig(planningTimeout, planningRounds, timeout, rounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withReviewGate(Duration timeout, int rounds) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            timeout, rounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withReflectionGate(Duration timeout, int rounds) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, timeout, rounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withMaxValidationAttempts(int maxValidationAttempts) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withMaxReviewCycles(int maxReviewCycles) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withMaxReverdictPasses(int maxReverdictPasses) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withPollInterval(Duration pollInterval) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withVerificationLevel(VerificationLevel verificationLevel) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }

    public OrchestratorConfig withDefaultSpecialist(String defaultSpecialist) {
        return new OrchestratorConfig(planningTimeout, planningRounds, implementationTimeout, implementationRounds,
            reviewTimeout, reviewRounds, reflectionTimeout, reflectionRounds, maxValidationAttempts,
            maxReviewCycles, maxReverdictPasses, pollInterval, verificationLevel, implementerName, defaultSpecialist);
    }
}
