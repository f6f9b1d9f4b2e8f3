package com.ryuqq.devloop.core.check;

/**
 * 단일 검사 실행 결과.
 *
 * @param passed 통과 여부
 * @param output 검사 출력 (빈 문자열 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CheckResult(boolean passed, String output) {

    public CheckResult {
        output = output == null ? "" : output;
    }

    public static CheckResult pass(String output) {
        return new CheckResult(true, output);
    }

    public static CheckResult fail(String output) {
        return new CheckResult(false, output);
    }
}
