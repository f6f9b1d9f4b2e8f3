package com.ryuqq.devloop.core.finding;

import java.util.Locale;

/**
 * 리뷰어 최종 판정.
 *
 * <ul>
 *   <li>CLEAR: Finding 없음</li>
 *   <li>RESOLVED: 모든 Finding이 수정되었거나 연기 수락됨</li>
 *   <li>ESCALATED: 해결되지 않은 이견이 남음 → 판정(adjudication) 필요</li>
 * </ul>
 *
 * <p>선언 순서가 엄격도 순서입니다 (CLEAR &lt; RESOLVED &lt; ESCALATED).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Verdict {

    CLEAR,

    RESOLVED,

    ESCALATED;

    /**
     * 리뷰 단계를 통과시키는 판정인지 확인.
     *
     * @return CLEAR 또는 RESOLVED이면 true
     */
    public boolean allowsAdvance() {
        return this != ESCALATED;
    }

    /**
     * 두 판정 중 더 엄격한 쪽.
     *
     * @param a 판정 A
     * @param b 판정 B
     * @return 더 엄격한 판정
     */
    public static Verdict stricter(Verdict a, Verdict b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Verdict parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("verdict cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown verdict: " + value, e);
        }
    }
}
