package com.ryuqq.devloop.core.gate;

import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.model.ActorName;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * 게이트 생성, 확인 기록, 시간 초과 판정.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>필수 참여자가 아닌 Actor의 확인은 무시</li>
 *   <li>지정된 종류가 아닌 메시지는 확인으로 인정하지 않음</li>
 *   <li>같은 참여자의 중복 확인은 무시 (멱등)</li>
 *   <li>SATISFIED는 시간이 지나도 유지</li>
 * </ul>
 *
 * <p>시간 판정은 주입된 {@link Clock}을 사용하므로 테스트에서 시간을 제어할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GateController {

    private final Clock clock;

    public GateController(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 게이트 생성.
     *
     * @param name 게이트 이름
     * @param required 필수 참여자
     * @param qualifyingKind 확인으로 인정되는 메시지 종류
     * @param timeout 라운드당 제한 시간
     * @param maxRounds 최대 라운드 수
     * @return 열린 게이트
     */
    public Gate open(String name, Collection<ActorName> required, String qualifyingKind,
                     Duration timeout, int maxRounds) {
        return new Gate(name, required, qualifyingKind, timeout, maxRounds, clock.instant());
    }

    /**
     * 메시지를 확인으로 기록.
     *
     * @param gate 게이트
     * @param message 수신 메시지
     * @return 새로 기록된 경우 true
     */
    public boolean recordConfirmation(Gate gate, Message message) {
        if (!message.isKind(gate.qualifyingKind())) {
            return false;
        }
        return gate.confirm(message.sender(), message);
    }

    /**
     * 게이트 상태 판정.
     *
     * @param gate 게이트
     * @return 현재 상태
     */
    public GateStatus poll(Gate gate) {
        if (gate.isSatisfied()) {
            return GateStatus.SATISFIED;
        }
        Duration elapsed = Duration.between(gate.roundStartedAt(), clock.instant());
        return elapsed.compareTo(gate.timeout()) >= 0 ? GateStatus.TIMED_OUT : GateStatus.OPEN;
    }

    /**
     * 시간 초과된 게이트를 다음 라운드로 연장.
     *
     * @param gate 게이트
     * @return 연장한 경우 true, 최대 라운드에 도달한 경우 false
     */
    public boolean extendRound(Gate gate) {
        if (gate.round() >= gate.maxRounds()) {
            return false;
        }
        gate.startNextRound(clock.instant());
        return true;
    }

    public GateEscalation escalation(Gate gate) {
        Instant now = clock.instant();
        return new GateEscalation(gate.name(), gate.round(), gate.confirmed(), gate.outstanding(),
            Duration.between(gate.roundStartedAt(), now));
    }

    public boolean isRequired(Gate gate, ActorName actor) {
        return gate.required().contains(actor);
    }
}
