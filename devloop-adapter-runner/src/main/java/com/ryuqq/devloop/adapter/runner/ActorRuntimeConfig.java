package com.ryuqq.devloop.adapter.runner;

/**
 * MailboxActorRuntime 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: mailbox 수신 대기 간격 (기본 50ms)</li>
 *   <li>maxDeliveries: 한 메시지의 최대 전달 시도 횟수, 초과 시 DLQ (기본 3)</li>
 *   <li>concurrency: Actor 워커 스레드 수 (기본 16, Actor 1개당 1스레드)</li>
 *   <li>shutdownGraceMs: 종료 시 워커 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalMs mailbox 수신 대기 간격 (밀리초, 양수여야 함)
 * @param maxDeliveries 최대 전달 시도 횟수 (1 이상이어야 함)
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param shutdownGraceMs 종료 대기 시간 (밀리초, 0 이상이어야 함)
 */
public record ActorRuntimeConfig(
    long pollIntervalMs,
    int maxDeliveries,
    int concurrency,
    long shutdownGraceMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=50ms, maxDeliveries=3, concurrency=16, shutdownGraceMs=5000ms</p>
     */
    public ActorRuntimeConfig() {
        this(50, 3, 16, 5000);
    }

    public ActorRuntimeConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (maxDeliveries <= 0) {
            throw new IllegalArgumentException(
                "maxDeliveries must be positive (current: " + maxDeliveries + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownGraceMs < 0) {
            throw new IllegalArgumentException(
                "shutdownGraceMs cannot be negative (current: " + shutdownGraceMs + ")"
            );
        }
    }

    public ActorRuntimeConfig withPollIntervalMs(long pollIntervalMs) {
        return new ActorRuntimeConfig(pollIntervalMs, maxDeliveries, concurrency, shutdownGraceMs);
    }

    public ActorRuntimeConfig withMaxDeliveries(int maxDeliveries) {
        return new ActorRuntimeConfig(pollIntervalMs, maxDeliveries, concurrency, shutdownGraceMs);
    }

    public ActorRuntimeConfig withConcurrency(int concurrency) {
        return new ActorRuntimeConfig(pollIntervalMs, maxDeliveries, concurrency, shutdownGraceMs);
    }

    public ActorRuntimeConfig withShutdownGraceMs(long shutdownGraceMs) {
        return new ActorRuntimeConfig(pollIntervalMs, maxDeliveries, concurrency, shutdownGraceMs);
    }
}
