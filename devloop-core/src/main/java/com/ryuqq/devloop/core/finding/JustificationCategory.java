package com.ryuqq.devloop.core.finding;

/**
 * 연기 사유 분류.
 *
 * <p>유효한 사유만 연기 수락 대상이 됩니다. 분류되지 않는 사유는 무효로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JustificationCategory {

    /** 이번 변경 범위 밖의 파일을 수정해야 함. */
    OUT_OF_SCOPE_FILES(true),

    /** 별도의 설계/테스트 사이클이 필요함. */
    NEEDS_OWN_DESIGN_CYCLE(true),

    /** 여러 컴포넌트 간 조율이 필요함. */
    CROSS_COMPONENT_COORDINATION(true),

    /** "사소하다" 류의 심각도 축소 표현. */
    SEVERITY_MINIMIZING(false),

    /** "지금도 동작한다". */
    WORKS_AS_IS(false),

    /** 차단 사유 없는 "나중에 하겠다". */
    DEFER_WITHOUT_REASON(false),

    UNRECOGNIZED(false);

    private final boolean valid;

    JustificationCategory(boolean valid) {
        this.valid = valid;
    }

    public boolean isValid() {
        return valid;
    }
}
