package com.ryuqq.devloop.core.check;

/**
 * 검사 실행 중 스레드가 인터럽트된 경우.
 *
 * <p>검증 실패가 아니므로 {@link CheckRunner}는 이 예외를 FAIL로 기록하지 않고 다시 던집니다.
 * 던지는 쪽은 인터럽트 플래그를 복원한 상태여야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CheckInterruptedException extends RuntimeException {

    public CheckInterruptedException(String checkName, Throwable cause) {
        super("Check '" + checkName + "' was interrupted", cause);
    }
}
