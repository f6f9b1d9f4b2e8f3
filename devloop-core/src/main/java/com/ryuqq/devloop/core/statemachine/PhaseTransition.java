package com.ryuqq.devloop.core.statemachine;

import com.ryuqq.devloop.core.model.Mode;

/**
 * 단계 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>SETUP → PLANNING (FULL) / IMPLEMENTATION (LIGHTWEIGHT)</li>
 *   <li>PLANNING → IMPLEMENTATION</li>
 *   <li>IMPLEMENTATION → VALIDATION</li>
 *   <li>VALIDATION → REVIEW / IMPLEMENTATION</li>
 *   <li>REVIEW → REFLECTION (FULL) / COMPLETE (LIGHTWEIGHT) / IMPLEMENTATION</li>
 *   <li>REFLECTION → COMPLETE</li>
 *   <li>비종료 단계 → ABANDONED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @param mode 세션 모드
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(Phase from, Phase to, Mode mode) {
        if (from == null || to == null || mode == null) {
            throw new IllegalArgumentException("Arguments cannot be null (from: " + from + ", to: " + to + ", mode: " + mode + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        if (to == Phase.ABANDONED) {
            return;
        }

        boolean valid = switch (from) {
            case SETUP -> mode.skipsPlanning() ? to == Phase.IMPLEMENTATION : to == Phase.PLANNING;
            case PLANNING -> to == Phase.IMPLEMENTATION;
            case IMPLEMENTATION -> to == Phase.VALIDATION;
            case VALIDATION -> to == Phase.REVIEW || to == Phase.IMPLEMENTATION;
            case REVIEW -> to == Phase.IMPLEMENTATION
                || (mode.skipsReflection() ? to == Phase.COMPLETE : to == Phase.REFLECTION);
            case REFLECTION -> to == Phase.COMPLETE;
            case COMPLETE, ABANDONED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition in %s mode: %s → %s", mode, from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @param mode 세션 모드
     * @return next
     */
    public static Phase transition(Phase current, Phase next, Mode mode) {
        validate(current, next, mode);
        return next;
    }

    /**
     * REVIEW 이후의 다음 단계.
     *
     * @param mode 세션 모드
     * @return FULL이면 REFLECTION, LIGHTWEIGHT이면 COMPLETE
     */
    public static Phase afterReview(Mode mode) {
        return mode.skipsReflection() ? Phase.COMPLETE : Phase.REFLECTION;
    }

    public static Phase afterSetup(Mode mode) {
        return mode.skipsPlanning() ? Phase.IMPLEMENTATION : Phase.PLANNING;
    }
}
