package com.ryuqq.devloop.core.check;

/**
 * 변경된 파일의 산출물 종류.
 *
 * <p>민감 종류를 건드리는 변경은 LIGHTWEIGHT 모드로 실행할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ArtifactKind {

    SOURCE(false),

    TEST(false),

    DOCUMENTATION(false),

    SCHEMA_MIGRATION(true),

    INTERFACE_DEFINITION(true),

    DEPENDENCY_MANIFEST(true),

    AUTH_CRYPTO(true),

    SHARED_CODE(true),

    INSTRUMENTATION(true);

    private final boolean sensitive;

    ArtifactKind(boolean sensitive) {
        this.sensitive = sensitive;
    }

    public boolean isSensitive() {
        return sensitive;
    }
}
