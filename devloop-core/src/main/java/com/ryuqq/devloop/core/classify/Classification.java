package com.ryuqq.devloop.core.classify;

import java.util.List;
import java.util.Optional;

/**
 * Specialist 분류 결과.
 *
 * <ul>
 *   <li>MATCHED: 단일 라벨 선택</li>
 *   <li>AMBIGUOUS: 동점 후보가 둘 이상</li>
 *   <li>UNMATCHED: 일치하는 키워드 없음</li>
 * </ul>
 *
 * @param kind 결과 종류
 * @param label 선택된 라벨 (MATCHED일 때만)
 * @param candidates 동점 후보 (AMBIGUOUS일 때만)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Classification(Kind kind, String label, List<String> candidates) {

    public enum Kind {
        MATCHED,
        AMBIGUOUS,
        UNMATCHED
    }

    public Classification {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.MATCHED && (label == null || label.isBlank())) {
            throw new IllegalArgumentException("label cannot be null or blank for a match");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static Classification matched(String label) {
        return new Classification(Kind.MATCHED, label, List.of());
    }

    public static Classification ambiguous(List<String> candidates) {
        return new Classification(Kind.AMBIGUOUS, null, candidates);
    }

    public static Classification unmatched() {
        return new Classification(Kind.UNMATCHED, null, List.of());
    }

    public Optional<String> labelIfMatched() {
        return Optional.ofNullable(label);
    }

    public boolean isAmbiguous() {
        return kind == Kind.AMBIGUOUS;
    }
}
