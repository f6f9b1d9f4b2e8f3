package com.ryuqq.devloop.core.check;

/**
 * 검증 실패 시 구현자에게 보내는 피드백.
 *
 * <p>출력은 {@value #MAX_OUTPUT_LENGTH}자로 잘립니다.</p>
 *
 * @param layer 실패한 계층
 * @param output 잘린 출력
 * @param hint 조치 힌트
 * @param truncated 출력이 잘렸는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationFeedback(
    String layer,
    String output,
    String hint,
    boolean truncated
) {

    public static final int MAX_OUTPUT_LENGTH = 2000;

    /**
     * 실패한 검증 실행으로부터 피드백 생성.
     *
     * @param run 검증 실행
     * @return 피드백
     * @throws IllegalArgumentException 통과한 실행인 경우
     */
    public static ValidationFeedback from(ValidationRun run) {
        LayerResult failed = run.firstFailure()
            .orElseThrow(() -> new IllegalArgumentException("Validation run " + run.iteration() + " has no failed layer"));
        String output = failed.output();
        boolean truncated = output.length() > MAX_OUTPUT_LENGTH;
        String kept = truncated ? output.substring(0, MAX_OUTPUT_LENGTH) : output;
        return new ValidationFeedback(failed.name(), kept, failed.hint(), truncated);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Layer '").append(layer).append("' failed.\n");
        sb.append(output);
        if (truncated) {
            sb.append("\n... (output truncated)");
        }
        if (!hint.isBlank()) {
            sb.append("\nHint: ").append(hint);
        }
        return sb.toString();
    }
}
