package com.ryuqq.devloop.core.check;

/**
 * 검사 도구 자체를 실행하지 못했을 때 발생 (프로세스 시작 실패, 타임아웃 등).
 *
 * <p>{@link CheckRunner}는 이 예외를 해당 계층의 FAIL로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CheckExecutionException extends RuntimeException {

    public CheckExecutionException(String message) {
        super(message);
    }

    public CheckExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
