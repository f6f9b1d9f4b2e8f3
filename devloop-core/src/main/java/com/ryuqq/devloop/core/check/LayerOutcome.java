package com.ryuqq.devloop.core.check;

/**
 * 검증 계층 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LayerOutcome {

    PASS,

    FAIL,

    /** 앞선 계층이 실패하여 실행하지 않음. */
    SKIPPED
}
