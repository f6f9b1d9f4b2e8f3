package com.ryuqq.devloop.core.model;

import java.time.Instant;

/**
 * 세션 생성 시점의 외부 리소스(작업 트리) 상태에 대한 불변 참조.
 *
 * <p>롤백 시 현재 상태를 이 마커와 비교합니다.
 * Git 워크스페이스에서는 커밋 해시, 인메모리 워크스페이스에서는 스냅샷 번호입니다.</p>
 *
 * @param reference 스냅샷 참조 (커밋 해시 등)
 * @param branch 세션 생성 시점의 브랜치 또는 식별자
 * @param markedAt 마커 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StartMarker(
    String reference,
    String branch,
    Instant markedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 비어있는 경우
     */
    public StartMarker {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference cannot be null or blank");
        }
        if (branch == null || branch.isBlank()) {
            throw new IllegalArgumentException("branch cannot be null or blank");
        }
        if (markedAt == null) {
            throw new IllegalArgumentException("markedAt cannot be null");
        }
    }
}
