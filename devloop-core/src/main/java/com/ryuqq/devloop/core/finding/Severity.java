package com.ryuqq.devloop.core.finding;

import java.util.Locale;

/**
 * Finding 심각도 (낮은 순서).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Severity {

    LOW,

    MEDIUM,

    HIGH,

    CRITICAL;

    /**
     * 이 심각도가 기준 이상인지 확인.
     *
     * @param threshold 기준 심각도
     * @return this ≥ threshold 이면 true
     */
    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * 대소문자 구분 없이 파싱.
     *
     * @param value 문자열 (예: "high")
     * @return Severity
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value, e);
        }
    }
}
