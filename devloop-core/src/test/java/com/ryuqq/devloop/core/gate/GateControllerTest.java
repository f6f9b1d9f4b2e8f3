package com.ryuqq.devloop.core.gate;

import com.ryuqq.devloop.core.contract.Message;
import com.ryuqq.devloop.core.contract.MessageKinds;
import com.ryuqq.devloop.core.model.ActorName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * GateController 테스트.
 *
 * <ul>
 *   <li>전원 확인 시 SATISFIED, 이후 시간이 지나도 유지 (단조성)</li>
 *   <li>필수 참여자가 아니거나 종류가 다른 메시지는 무시</li>
 *   <li>시간 초과 → 라운드 연장 → 최대 라운드 후 에스컬레이션</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class GateControllerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final ActorName SECURITY = ActorName.of("security");
    private static final ActorName TEST = ActorName.of("test");
    private static final ActorName IMPLEMENTER = ActorName.of("implementer");

    @Mock
    private Clock clock;

    private GateController controller;

    @BeforeEach
    void setUp() {
        controller = new GateController(clock);
    }

    private Message from(ActorName sender, String kind) {
        return Message.of(sender, ActorName.ORCHESTRATOR, kind, "", Map.of(), T0);
    }

    private Gate openPlanningGate() {
        when(clock.instant()).thenReturn(T0);
        return controller.open("planning", List.of(SECURITY, TEST), MessageKinds.PLAN_CONFIRMED,
            Duration.ofMinutes(30), 3);
    }

    @Test
    void poll_AllRequiredConfirmed_Satisfied() {
        // given
        Gate gate = openPlanningGate();

        // when
        controller.recordConfirmation(gate, from(SECURITY, MessageKinds.PLAN_CONFIRMED));
        controller.recordConfirmation(gate, from(TEST, MessageKinds.PLAN_CONFIRMED));

        // then
        assertThat(controller.poll(gate)).isEqualTo(GateStatus.SATISFIED);
        assertThat(gate.confirmed()).containsExactly(SECURITY, TEST);
        assertThat(gate.outstanding()).isEmpty();
    }

    @Test
    void poll_SatisfiedGate_StaysSatisfiedAfterTimeout() {
        // given
        Gate gate = openPlanningGate();
        controller.recordConfirmation(gate, from(SECURITY, MessageKinds.PLAN_CONFIRMED));
        controller.recordConfirmation(gate, from(TEST, MessageKinds.PLAN_CONFIRMED));

        // when: 2시간 경과
        lenient().when(clock.instant()).thenReturn(T0.plus(Duration.ofHours(2)));

        // then
        assertThat(controller.poll(gate)).isEqualTo(GateStatus.SATISFIED);
    }

    @Test
    void recordConfirmation_DuplicateConfirmation_IsIdempotent() {
        Gate gate = openPlanningGate();

        boolean first = controller.recordConfirmation(gate, from(SECURITY, MessageKinds.PLAN_CONFIRMED));
        boolean second = controller.recordConfirmation(gate, from(SECURITY, MessageKinds.PLAN_CONFIRMED));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(gate.confirmed()).containsExactly(SECURITY);
        assertThat(gate.isSatisfied()).isFalse();
    }

    @Test
    void recordConfirmation_NonRequiredActorOrWrongKind_Ignored() {
        Gate gate = openPlanningGate();

        assertThat(controller.recordConfirmation(gate, from(IMPLEMENTER, MessageKinds.PLAN_CONFIRMED))).isFalse();
        assertThat(controller.recordConfirmation(gate, from(SECURITY, MessageKinds.DISCUSSION))).isFalse();
        assertThat(gate.confirmed()).isEmpty();
    }

    @Test
    void poll_TimeoutElapsed_TimedOutThenExtended() {
        // given
        Gate gate = openPlanningGate();
        controller.recordConfirmation(gate, from(SECURITY, MessageKinds.PLAN_CONFIRMED));

        // when
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(30)));

        // then
        assertThat(controller.poll(gate)).isEqualTo(GateStatus.TIMED_OUT);
        assertThat(controller.extendRound(gate)).isTrue();
        assertThat(gate.round()).isEqualTo(2);
        assertThat(controller.poll(gate)).isEqualTo(GateStatus.OPEN);
        assertThat(gate.confirmed()).containsExactly(SECURITY);
    }

    @Test
    void extendRound_MaxRoundsReached_ReturnsFalseAndEscalates() {
        // given
        Gate gate = openPlanningGate();
        controller.recordConfirmation(gate, from(TEST, MessageKinds.PLAN_CONFIRMED));
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(30)));
        controller.extendRound(gate);
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(60)));
        controller.extendRound(gate);
        when(clock.instant()).thenReturn(T0.plus(Duration.ofMinutes(90)));

        // when
        boolean extended = controller.extendRound(gate);
        GateEscalation escalation = controller.escalation(gate);

        // then
        assertThat(extended).isFalse();
        assertThat(controller.poll(gate)).isEqualTo(GateStatus.TIMED_OUT);
        assertThat(escalation.rounds()).isEqualTo(3);
        assertThat(escalation.confirmed()).containsExactly(TEST);
        assertThat(escalation.outstanding()).containsExactly(SECURITY);
        assertThat(escalation.summary()).contains("planning", "3 round(s)");
    }

    @Test
    void open_EmptyRequiredSet_IsSatisfiedImmediately() {
        when(clock.instant()).thenReturn(T0);

        Gate gate = controller.open("reverdict", List.of(), MessageKinds.VERDICT, Duration.ofMinutes(1), 1);

        assertThat(controller.poll(gate)).isEqualTo(GateStatus.SATISFIED);
    }
}
