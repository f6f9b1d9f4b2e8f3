package com.ryuqq.devloop.core.model;

import java.util.regex.Pattern;

/**
 * 메시지 주소로 사용되는 Actor 이름.
 *
 * <p>세션 내에서 유일해야 하며, 예약된 이름 {@code orchestrator}는
 * Orchestrator 자신의 메일박스를 가리킵니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ActorName.of("implementer")</li>
 *   <li>ActorName.of("security-reviewer")</li>
 *   <li>{@link #ORCHESTRATOR}</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자로 시작, 소문자/숫자/하이픈만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ActorName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9\\-]*$");

    /**
     * Orchestrator 메일박스 주소.
     */
    public static final ActorName ORCHESTRATOR = new ActorName("orchestrator");

    private final String value;

    private ActorName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActorName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("ActorName length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("ActorName must start with a lowercase letter and contain only lowercase letters, digits and hyphens");
        }
        this.value = value;
    }

    /**
     * ActorName 생성.
     *
     * @param value 이름 (예: implementer, security-reviewer)
     * @return ActorName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ActorName of(String value) {
        if (ORCHESTRATOR.value.equals(value)) {
            return ORCHESTRATOR;
        }
        return new ActorName(value);
    }

    public String getValue() {
        return value;
    }

    /**
     * Orchestrator 주소인지 확인.
     *
     * @return orchestrator인 경우 true
     */
    public boolean isOrchestrator() {
        return ORCHESTRATOR.value.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActorName actorName = (ActorName) o;
        return value.equals(actorName.value);
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
