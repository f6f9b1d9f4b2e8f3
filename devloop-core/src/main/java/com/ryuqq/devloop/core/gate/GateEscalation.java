package com.ryuqq.devloop.core.gate;

import com.ryuqq.devloop.core.model.ActorName;

import java.time.Duration;
import java.util.List;

/**
 * 게이트가 최대 라운드까지 시간 초과되었을 때 사람에게 보고하는 내용.
 *
 * @param gateName 게이트 이름
 * @param rounds 소진된 라운드 수
 * @param confirmed 확인한 참여자
 * @param outstanding 확인하지 않은 참여자
 * @param waited 마지막 라운드 대기 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GateEscalation(
    String gateName,
    int rounds,
    List<ActorName> confirmed,
    List<ActorName> outstanding,
    Duration waited
) {

    public GateEscalation {
        confirmed = List.copyOf(confirmed);
        outstanding = List.copyOf(outstanding);
    }

    public String summary() {
        return String.format("Gate '%s' timed out after %d round(s): confirmed %s, outstanding %s",
            gateName, rounds, confirmed, outstanding);
    }
}
