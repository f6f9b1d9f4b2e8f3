package com.ryuqq.devloop.core.check;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 세션 시작 마커 이후 작업 트리의 변경.
 *
 * @param paths 변경된 경로 (정렬됨)
 * @param diff 변경 내용 텍스트
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Change(List<String> paths, String diff) {

    public Change {
        paths = paths == null ? List.of() : paths.stream().sorted().distinct().toList();
        diff = diff == null ? "" : diff;
    }

    public static Change empty() {
        return new Change(List.of(), "");
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public Set<ArtifactKind> artifactKinds() {
        if (paths.isEmpty()) {
            return EnumSet.noneOf(ArtifactKind.class);
        }
        return ArtifactClassifier.classifyAll(paths);
    }

    public boolean touches(ArtifactKind kind) {
        return paths.stream().anyMatch(path -> ArtifactClassifier.classify(path).contains(kind));
    }

    /**
     * 민감 종류에 해당하는 경로.
     *
     * @return 경로 목록
     */
    public List<String> sensitivePaths() {
        return paths.stream()
            .filter(path -> ArtifactClassifier.classify(path).stream().anyMatch(ArtifactKind::isSensitive))
            .toList();
    }
}
