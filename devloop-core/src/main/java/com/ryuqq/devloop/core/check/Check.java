package com.ryuqq.devloop.core.check;

/**
 * 자동 검증 계층 하나.
 *
 * <p>구현체는 외부 도구 실행(컴파일러, 포매터, 테스트 러너 등)을 감쌉니다.
 * {@link #run}에서 발생한 예외는 해당 계층의 실패로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Check {

    /**
     * 계층 이름 (예: compile, tests).
     *
     * @return 이름
     */
    String name();

    /**
     * 계층이 검증하는 내용.
     *
     * @return 한 줄 설명
     */
    String purpose();

    /**
     * 실패 시 구현자에게 전달할 조치 힌트.
     *
     * @return 힌트
     */
    default String hint() {
        return StandardLayers.hint(name());
    }

    /**
     * 이 검사를 실행하는 최소 검증 수준.
     *
     * @return 최소 수준 (표준 계층이 아니면 FULL)
     */
    default VerificationLevel level() {
        return StandardLayers.minimumLevel(name());
    }

    /**
     * 변경에 대해 이 검사가 활성화되는지 확인.
     *
     * <p>산출물 기반 추가 검사(스키마 마이그레이션 등)는 해당 산출물이 변경된 경우에만 활성화됩니다.</p>
     *
     * @param change 검증 대상 변경
     * @return 활성화되면 true
     */
    default boolean appliesTo(Change change) {
        return StandardLayers.appliesTo(name(), change);
    }

    /**
     * 검사 실행.
     *
     * @param change 검증 대상 변경
     * @return 결과
     */
    CheckResult run(Change change);
}
