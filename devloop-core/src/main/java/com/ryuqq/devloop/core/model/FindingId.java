package com.ryuqq.devloop.core.model;

/**
 * 리뷰 Finding 식별자.
 *
 * <p>FindingLedger가 세션 내에서 순번으로 발급합니다 (예: {@code F-1}, {@code F-2}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FindingId {

    private static final String PREFIX = "F-";

    private final String value;

    private FindingId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FindingId cannot be null or blank");
        }
        if (!value.matches("^F-[1-9][0-9]*$")) {
            throw new IllegalArgumentException("FindingId must match F-<positive number> (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 문자열로부터 FindingId 생성.
     *
     * @param value FindingId 값 (예: F-3)
     * @return FindingId 인스턴스
     * @throws IllegalArgumentException 형식이 맞지 않는 경우
     */
    public static FindingId of(String value) {
        return new FindingId(value);
    }

    /**
     * 순번으로부터 FindingId 생성.
     *
     * @param sequence 1부터 시작하는 순번
     * @return FindingId 인스턴스
     * @throws IllegalArgumentException sequence가 양수가 아닌 경우
     */
    public static FindingId ofSequence(int sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        return new FindingId(PREFIX + sequence);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FindingId findingId = (FindingId) o;
        return value.equals(findingId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
