package com.ryuqq.devloop.core.session;

import com.ryuqq.devloop.core.check.ArtifactClassifier;
import com.ryuqq.devloop.core.check.ArtifactKind;
import com.ryuqq.devloop.core.model.Mode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * LIGHTWEIGHT 모드 허용 여부의 정적 판정.
 *
 * <p>인증/암호, 스키마/인터페이스, 의존성 매니페스트, 공용 코드, 계측 코드 중 하나라도 건드리면
 * LIGHTWEIGHT는 거부되고 FULL로 전환됩니다. 세션 설정 시에는 대상 경로로,
 * 첫 검증 시에는 실제 변경 경로로 다시 판정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModeEligibility {

    private ModeEligibility() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ModeDecision evaluate(Mode requested, Collection<String> paths) {
        if (requested == null) {
            throw new IllegalArgumentException("requested cannot be null");
        }
        if (requested == Mode.FULL || paths == null || paths.isEmpty()) {
            return new ModeDecision(requested, requested, Set.of(), List.of());
        }

        Set<ArtifactKind> kinds = EnumSet.noneOf(ArtifactKind.class);
        List<String> sensitivePaths = new ArrayList<>();
        for (String path : paths) {
            boolean sensitive = false;
            for (ArtifactKind kind : ArtifactClassifier.classify(path)) {
                if (kind.isSensitive()) {
                    kinds.add(kind);
                    sensitive = true;
                }
            }
            if (sensitive) {
                sensitivePaths.add(path);
            }
        }

        Mode effective = kinds.isEmpty() ? Mode.LIGHTWEIGHT : Mode.FULL;
        return new ModeDecision(requested, effective, kinds, sensitivePaths);
    }
}
