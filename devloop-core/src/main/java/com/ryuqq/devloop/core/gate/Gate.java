package com.ryuqq.devloop.core.gate;

import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.model.ActorName;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 단계 진행 조건이 되는 확인 집합.
 *
 * <p>필수 참여자 전원이 지정된 종류의 메시지를 보내야 충족됩니다.
 * 확인 집합은 단조 증가하며, 한 번 기록된 확인은 제거되지 않습니다.</p>
 *
 * <p>상태 변경은 {@link GateController}를 통해서만 이루어집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Gate {

    private final String name;
    private final Set<ActorName> required;
    private final String qualifyingKind;
    private final Duration timeout;
    private final int maxRounds;
    private final Map<ActorName, Message> confirmations = new LinkedHashMap<>();
    private int round;
    private Instant roundStartedAt;
    private boolean satisfied;

    Gate(String name, Collection<ActorName> required, String qualifyingKind,
         Duration timeout, int maxRounds, Instant openedAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (required == null) {
            throw new IllegalArgumentException("required cannot be null");
        }
        if (qualifyingKind == null || qualifyingKind.isBlank()) {
            throw new IllegalArgumentException("qualifyingKind cannot be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive (current: " + maxRounds + ")");
        }
        this.name = name;
        this.required = Set.copyOf(new LinkedHashSet<>(required));
        this.qualifyingKind = qualifyingKind;
        this.timeout = timeout;
        this.maxRounds = maxRounds;
        this.round = 1;
        this.roundStartedAt = openedAt;
        this.satisfied = this.required.isEmpty();
    }

    boolean confirm(ActorName actor, Message message) {
        if (!required.contains(actor) || confirmations.containsKey(actor)) {
            return false;
        }
        confirmations.put(actor, message);
        if (confirmations.size() == required.size()) {
            satisfied = true;
        }
        return true;
    }

    void startNextRound(Instant now) {
        round++;
        roundStartedAt = now;
    }

    public String name() {
        return name;
    }

    public Set<ActorName> required() {
        return required;
    }

    public String qualifyingKind() {
        return qualifyingKind;
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxRounds() {
        return maxRounds;
    }

    public int round() {
        return round;
    }

    public Instant roundStartedAt() {
        return roundStartedAt;
    }

    public boolean isSatisfied() {
        return satisfied;
    }

    /**
     * 확인한 참여자 (확인 순서).
     *
     * @return 불변 목록
     */
    public List<ActorName> confirmed() {
        return List.copyOf(confirmations.keySet());
    }

    /**
     * 아직 확인하지 않은 참여자.
     *
     * @return 불변 목록
     */
    public List<ActorName> outstanding() {
        return required.stream()
            .filter(actor -> !confirmations.containsKey(actor))
            .sorted((a, b) -> a.getValue().compareTo(b.getValue()))
            .toList();
    }

    /**
     * 참여자의 확인 메시지.
     *
     * @param actor 참여자
     * @return 확인 메시지, 없으면 null
     */
    public Message confirmationOf(ActorName actor) {
        return confirmations.get(actor);
    }

    @Override
    public String toString() {
        return "Gate{" + name + ", confirmed=" + confirmations.size() + "/" + required.size()
            + ", round=" + round + "/" + maxRounds + '}';
    }
}
