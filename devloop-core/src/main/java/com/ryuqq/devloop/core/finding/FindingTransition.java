package com.ryuqq.devloop.core.finding;

/**
 * Finding 상태 전이 검증.
 *
 * <p>FIXED, DEFERRED_ACCEPTED는 종료 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FindingTransition {

    private FindingTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(FindingStatus from, FindingStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid finding transition: %s → %s", from, to)
            );
        }
    }

    public static boolean isAllowed(FindingStatus from, FindingStatus to) {
        return switch (from) {
            case OPEN -> to == FindingStatus.FIXED
                || to == FindingStatus.DEFERRED_PROPOSED
                || to == FindingStatus.DEFERRED_ACCEPTED
                || to == FindingStatus.ESCALATED;
            case DEFERRED_PROPOSED -> to == FindingStatus.DEFERRED_ACCEPTED
                || to == FindingStatus.ESCALATED
                || to == FindingStatus.FIXED;
            case ESCALATED -> to == FindingStatus.DEFERRED_ACCEPTED || to == FindingStatus.FIXED;
            case FIXED, DEFERRED_ACCEPTED -> false;
        };
    }
}
