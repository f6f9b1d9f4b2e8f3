package com.ryuqq.devloop.core.contract;

/**
 * MessageBus가 수신자에게 전달한 메시지 한 건.
 *
 * <p>수신자는 처리 완료 후 {@code ack}, 실패 시 {@code nack}으로 응답합니다.
 * 재전달될 때마다 {@code attempt}가 증가합니다.</p>
 *
 * @param deliveryId 전달 ID (ack/nack 대상)
 * @param message 전달된 메시지
 * @param attempt 전달 시도 횟수 (1부터)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Delivery(
    long deliveryId,
    Message message,
    int attempt
) {

    public Delivery {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    /**
     * 재전달용 사본 생성.
     *
     * @return attempt가 1 증가한 Delivery
     */
    public Delivery nextAttempt() {
        return new Delivery(deliveryId, message, attempt + 1);
    }
}
