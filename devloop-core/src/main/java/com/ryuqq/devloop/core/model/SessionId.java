package com.ryuqq.devloop.core.model;

import java.util.UUID;

/**
 * Session의 전역 고유 식별자.
 *
 * <p>SessionId는 세션 기록 저장, 상태 조회, 중단된 세션의 재시작
 * ({@code continueSession}) 시 이전 세션을 찾는 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionId {

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("SessionId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SessionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SessionId 생성.
     *
     * @param value SessionId 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * UUID 기반 SessionId 생성.
     *
     * @return 새 SessionId
     */
    public static SessionId generate() {
        return new SessionId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId sessionId = (SessionId) o;
        return value.equals(sessionId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionId{" + value + '}';
    }
}
