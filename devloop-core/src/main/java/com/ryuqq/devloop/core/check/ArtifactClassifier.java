package com.ryuqq.devloop.core.check;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 경로 패턴으로 산출물 종류를 판별.
 *
 * <p>하나의 경로가 여러 종류에 해당할 수 있습니다 (예: {@code shared/auth/Token.java}).
 * 어떤 특수 종류에도 해당하지 않으면 SOURCE입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ArtifactClassifier {

    private record PathRule(ArtifactKind kind, Pattern pattern) {
    }

    private static final List<PathRule> RULES = List.of(
        rule(ArtifactKind.SCHEMA_MIGRATION, "(^|/)(migrations?|db/migration|schema)/.+"),
        rule(ArtifactKind.SCHEMA_MIGRATION, "\\.sql$"),
        rule(ArtifactKind.INTERFACE_DEFINITION, "\\.(proto|graphql|graphqls|avsc|thrift)$"),
        rule(ArtifactKind.INTERFACE_DEFINITION, "(^|/)(openapi|swagger)[^/]*\\.(ya?ml|json)$"),
        rule(ArtifactKind.DEPENDENCY_MANIFEST,
            "(^|/)(pom\\.xml|build\\.gradle(\\.kts)?|settings\\.gradle(\\.kts)?|cargo\\.toml|cargo\\.lock"
                + "|package\\.json|package-lock\\.json|yarn\\.lock|go\\.mod|go\\.sum|requirements\\.txt)$"),
        rule(ArtifactKind.AUTH_CRYPTO, "(^|/)(auth|authn|authz|crypto|security|jwt|tokens?|oauth)(/|[-_.])"),
        rule(ArtifactKind.SHARED_CODE, "(^|/)(common|shared)(/|[-_.])"),
        rule(ArtifactKind.INSTRUMENTATION,
            "(^|/)(observability|metrics|telemetry|tracing|grafana|prometheus|dashboards)(/|[-_.])"),
        rule(ArtifactKind.TEST, "(^|/)(tests?|src/test)/"),
        rule(ArtifactKind.TEST, "(test|tests|_test|\\.test|\\.spec)\\.[a-z]+$"),
        rule(ArtifactKind.DOCUMENTATION, "(^|/)docs?/"),
        rule(ArtifactKind.DOCUMENTATION, "\\.(md|adoc|rst|txt)$")
    );

    private ArtifactClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 경로 하나의 산출물 종류.
     *
     * @param path 작업 트리 기준 상대 경로
     * @return 해당 종류 집합 (비어있지 않음)
     */
    public static Set<ArtifactKind> classify(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        String normalized = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        Set<ArtifactKind> kinds = EnumSet.noneOf(ArtifactKind.class);
        for (PathRule rule : RULES) {
            if (rule.pattern().matcher(normalized).find()) {
                kinds.add(rule.kind());
            }
        }
        // requirements.txt 같은 매니페스트는 문서가 아님
        if (kinds.contains(ArtifactKind.DEPENDENCY_MANIFEST)) {
            kinds.remove(ArtifactKind.DOCUMENTATION);
        }
        if (kinds.isEmpty()) {
            kinds.add(ArtifactKind.SOURCE);
        }
        return kinds;
    }

    public static Set<ArtifactKind> classifyAll(Iterable<String> paths) {
        Set<ArtifactKind> kinds = EnumSet.noneOf(ArtifactKind.class);
        for (String path : paths) {
            kinds.addAll(classify(path));
        }
        return kinds;
    }

    private static PathRule rule(ArtifactKind kind, String regex) {
        return new PathRule(kind, Pattern.compile(regex));
    }
}
