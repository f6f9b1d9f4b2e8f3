package com.ryuqq.devloop.core.statemachine;

import com.ryuqq.devloop.core.model.Mode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.devloop.core.statemachine.Phase.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PhaseTransition 테스트.
 *
 * <ul>
 *   <li>FULL 모드 정상 흐름: SETUP → PLANNING → ... → REFLECTION → COMPLETE</li>
 *   <li>LIGHTWEIGHT 모드: PLANNING, REFLECTION 생략</li>
 *   <li>종료 단계에서의 전이 불가</li>
 *   <li>비종료 단계에서 ABANDONED 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PhaseTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_FullModeHappyPath_ReachesComplete() {
        // Given
        Phase phase = SETUP;

        // When
        phase = PhaseTransition.transition(phase, PLANNING, Mode.FULL);
        phase = PhaseTransition.transition(phase, IMPLEMENTATION, Mode.FULL);
        phase = PhaseTransition.transition(phase, VALIDATION, Mode.FULL);
        phase = PhaseTransition.transition(phase, REVIEW, Mode.FULL);
        phase = PhaseTransition.transition(phase, REFLECTION, Mode.FULL);
        phase = PhaseTransition.transition(phase, COMPLETE, Mode.FULL);

        // Then
        assertEquals(COMPLETE, phase);
        assertTrue(phase.isTerminal());
    }

    @Test
    void transition_LightweightSkipsPlanningAndReflection() {
        Phase phase = PhaseTransition.transition(SETUP, IMPLEMENTATION, Mode.LIGHTWEIGHT);
        phase = PhaseTransition.transition(phase, VALIDATION, Mode.LIGHTWEIGHT);
        phase = PhaseTransition.transition(phase, REVIEW, Mode.LIGHTWEIGHT);
        phase = PhaseTransition.transition(phase, COMPLETE, Mode.LIGHTWEIGHT);

        assertEquals(COMPLETE, phase);
    }

    @Test
    void validate_ValidationFailureLoopsBackToImplementation() {
        assertDoesNotThrow(() -> PhaseTransition.validate(VALIDATION, IMPLEMENTATION, Mode.FULL));
        assertDoesNotThrow(() -> PhaseTransition.validate(REVIEW, IMPLEMENTATION, Mode.LIGHTWEIGHT));
    }

    // ========== 모드별 불법 전이 ==========

    @Test
    void validate_FullModeSkippingPlanning_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(SETUP, IMPLEMENTATION, Mode.FULL)
        );
        assertTrue(exception.getMessage().contains("SETUP → IMPLEMENTATION"));
    }

    @Test
    void validate_LightweightEnteringReflection_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> PhaseTransition.validate(REVIEW, REFLECTION, Mode.LIGHTWEIGHT));
        assertThrows(IllegalStateException.class, () -> PhaseTransition.validate(SETUP, PLANNING, Mode.LIGHTWEIGHT));
    }

    @Test
    void validate_ImplementationDirectlyToReview_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> PhaseTransition.validate(IMPLEMENTATION, REVIEW, Mode.FULL));
    }

    // ========== 종료 / 중단 ==========

    @ParameterizedTest
    @EnumSource(value = Phase.class, names = {"COMPLETE", "ABANDONED"})
    void validate_FromTerminalPhase_ThrowsException(Phase terminal) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(terminal, IMPLEMENTATION, Mode.FULL)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @ParameterizedTest
    @EnumSource(value = Phase.class, names = {"SETUP", "PLANNING", "IMPLEMENTATION", "VALIDATION", "REVIEW", "REFLECTION"})
    void validate_AnyActivePhaseToAbandoned_Succeeds(Phase active) {
        assertDoesNotThrow(() -> PhaseTransition.validate(active, ABANDONED, Mode.FULL));
    }

    @Test
    void validate_NullArguments_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.validate(null, PLANNING, Mode.FULL));
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.validate(SETUP, PLANNING, null));
    }
}
