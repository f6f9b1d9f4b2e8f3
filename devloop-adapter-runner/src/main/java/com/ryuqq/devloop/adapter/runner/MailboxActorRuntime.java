package com.ryuqq.devloop.adapter.runner;

import com.ryuqq.devloop.application.runtime.ActorRuntime;
import com.ryuqq.devloop.core.actor.Actor;
import com.ryuqq.devloop.core.actor.ActorStatus;
import com.ryuqq.devloop.core.contract.Delivery;
import com.ryuqq.devloop.core.model.ActorName;
import com.ryuqq.devloop.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Mailbox 기반 Actor Runtime 구현체.
 *
 * <p>Actor마다 워커 스레드 하나가 자신의 mailbox를 FIFO로 소비합니다.
 * 메시지 하나를 처리하는 동안 Actor는 ACTIVE, 그 외에는 IDLE입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * receive(actor, pollInterval)
 *   ↓
 * 이미 처리한 MessageId → ack 후 skip (at-least-once 중복 제거)
 *   ↓
 * ACTIVE → actor.onMessage(message, context) → IDLE
 *   ↓
 * 성공 → ack
 * 실패 → attempt &lt; maxDeliveries: backoff 후 nack (큐 맨 앞 재전달)
 *        attempt ≥ maxDeliveries: DLQ
 * </pre>
 *
 * <p><strong>주의:</strong> Actor 상태는 관찰용입니다. IDLE은 작업 완료를 의미하지 않으며,
 * 오케스트레이터는 상태가 아니라 메시지로만 단계를 전이합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MailboxActorRuntime implements ActorRuntime {

    private static final Logger log = LoggerFactory.getLogger(MailboxActorRuntime.class);

    private final MessageBus bus;
    private final ActorRuntimeConfig config;
    private final Clock clock;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;
    private final Map<ActorName, ActorStatus> statuses = new ConcurrentHashMap<>();
    private final Map<ActorName, RecentMessageIds> processed = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public MailboxActorRuntime(MessageBus bus, ActorRuntimeConfig config, Clock clock) {
        this(bus, config, clock, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param bus 메시지 버스
     * @param config 설정
     * @param clock 메시지 송신 시각용 시계
     * @param backoffCalculator 재전달 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MailboxActorRuntime(MessageBus bus, ActorRuntimeConfig config, Clock clock,
                               BackoffCalculator backoffCalculator) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.bus = bus;
        this.config = config;
        this.clock = clock;
        this.backoffCalculator = backoffCalculator;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public synchronized void spawn(Actor actor) {
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (!running) {
            throw new IllegalStateException("Runtime has been shut down");
        }
        ActorName name = actor.name();
        if (statuses.containsKey(name)) {
            throw new IllegalStateException("Actor already spawned: " + name);
        }
        if (statuses.size() >= config.concurrency()) {
            throw new IllegalStateException(
                "Actor capacity exhausted (concurrency: " + config.concurrency() + ", actor: " + name + ")"
            );
        }

        bus.register(name);
        statuses.put(name, ActorStatus.IDLE);
        processed.put(name, new RecentMessageIds());

        Map<String, String> parentContext = MDC.getCopyOfContextMap();
        workerExecutor.submit(() -> runLoop(actor, parentContext));
        log.info("Actor spawned: {}", name);
    }

    @Override
    public ActorStatus status(ActorName name) {
        return statuses.getOrDefault(name, ActorStatus.STOPPED);
    }

    @Override
    public Map<ActorName, ActorStatus> statuses() {
        return Map.copyOf(statuses);
    }

    /**
     * Runtime 종료.
     *
     * <p>워커 스레드를 인터럽트하여 blocking receive를 깨우고,
     * shutdownGraceMs 동안 종료를 기다립니다.</p>
     */
    @Override
    public void shutdown() {
        running = false;
        workerExecutor.shutdownNow();
        try {
            if (!workerExecutor.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Actor workers did not stop within {}ms", config.shutdownGraceMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        statuses.replaceAll((name, status) -> ActorStatus.STOPPED);
        processed.clear();
        log.info("Actor runtime shut down: {} actor(s) stopped", statuses.size());
    }

    private void runLoop(Actor actor, Map<String, String> parentContext) {
        ActorName name = actor.name();
        if (parentContext != null) {
            MDC.setContextMap(parentContext);
        }
        MdcContext.setActor(name.getValue());
        DefaultActorContext context = new DefaultActorContext(name, bus, clock);

        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                Optional<Delivery> received = bus.receive(name, config.pollIntervalMs());
                received.ifPresent(delivery -> handle(actor, context, delivery));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IllegalArgumentException e) {
            // mailbox가 먼저 해제된 경우
            log.debug("Actor {} mailbox closed: {}", name, e.getMessage());
        } finally {
            statuses.put(name, ActorStatus.STOPPED);
            MDC.clear();
        }
    }

    /**
     * 메시지 하나 처리.
     *
     * <p>Actor 예외가 루프를 종료시키지 않도록 여기서 흡수하고 재전달/DLQ로 넘깁니다.</p>
     */
    private void handle(Actor actor, DefaultActorContext context, Delivery delivery) {
        ActorName name = actor.name();
        RecentMessageIds seen = processed.get(name);
        String messageId = delivery.message().id();

        if (seen == null) {
            // shutdown 이후 도착한 메시지
            bus.nack(delivery);
            return;
        }
        if (seen.contains(messageId)) {
            log.debug("Duplicate delivery {} of message {} to {}, skipped", delivery.attempt(), messageId, name);
            bus.ack(delivery);
            return;
        }

        statuses.put(name, ActorStatus.ACTIVE);
        try {
            context.bind(delivery.message());
            actor.onMessage(delivery.message(), context);
            seen.add(messageId);
            bus.ack(delivery);
        } catch (RuntimeException e) {
            onFailure(name, delivery, e);
        } finally {
            if (running) {
                statuses.put(name, ActorStatus.IDLE);
            }
        }
    }

    int processedCount(ActorName name) {
        RecentMessageIds seen = processed.get(name);
        return seen == null ? 0 : seen.size();
    }

    private void onFailure(ActorName name, Delivery delivery, RuntimeException e) {
        String kind = delivery.message().kind();
        if (delivery.attempt() >= config.maxDeliveries()) {
            String reason = String.format("Actor %s failed on %s after %d attempt(s): %s",
                name, kind, delivery.attempt(), e.getMessage());
            bus.deadLetter(delivery, reason);
            log.error("Dead-lettered message {} ({}) for {}", delivery.message().id(), kind, name, e);
            return;
        }

        long delay = backoffCalculator.calculate(delivery.attempt());
        log.warn("Actor {} failed on {} (attempt {}), redelivering after {}ms: {}",
            name, kind, delivery.attempt(), delay, e.getMessage());
        try {
            Thread.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        bus.nack(delivery);
    }
}
