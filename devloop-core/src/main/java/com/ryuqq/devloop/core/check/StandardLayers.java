package com.ryuqq.devloop.core.check;

import java.util.List;

/**
 * 표준 검증 계층 이름과 실행 순서.
 *
 * <p>앞 계층일수록 빠르고 근본적인 검사입니다. 산출물 기반 추가 검사는 마지막에 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StandardLayers {

    public static final String COMPILE = "compile";
    public static final String FORMAT = "format";
    public static final String STATIC_GUARDS = "static-guards";
    public static final String TESTS = "tests";
    public static final String LINT = "lint";
    public static final String DEPENDENCY_AUDIT = "dependency-audit";
    public static final String SCHEMA_MIGRATION = "schema-migration";
    public static final String INTERFACE_CONTRACT = "interface-contract";

    /** 표준 실행 순서. */
    public static final List<String> ORDER = List.of(
        COMPILE, FORMAT, STATIC_GUARDS, TESTS, LINT, DEPENDENCY_AUDIT, SCHEMA_MIGRATION, INTERFACE_CONTRACT
    );

    private StandardLayers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 표준 계층의 최소 검증 수준.
     *
     * @param layer 계층 이름
     * @return 최소 수준, 표준 계층이 아니면 FULL
     */
    public static VerificationLevel minimumLevel(String layer) {
        return switch (layer) {
            case COMPILE, STATIC_GUARDS -> VerificationLevel.QUICK;
            case FORMAT, TESTS -> VerificationLevel.STANDARD;
            default -> VerificationLevel.FULL;
        };
    }

    /**
     * 표준 계층의 실패 힌트.
     *
     * @param layer 계층 이름
     * @return 힌트
     */
    public static String hint(String layer) {
        return switch (layer) {
            case COMPILE -> "Fix compilation errors before proceeding";
            case FORMAT -> "Run the formatter and commit the result";
            case STATIC_GUARDS -> "Remove the flagged pattern (credentials, forbidden calls) from the change";
            case TESTS -> "Fix the failing tests; do not delete or weaken assertions";
            case LINT -> "Address the lint warnings or justify each suppression";
            case DEPENDENCY_AUDIT -> "Upgrade or replace the vulnerable dependency";
            case SCHEMA_MIGRATION -> "Make the migration reversible and consistent with existing schema";
            case INTERFACE_CONTRACT -> "Keep the interface backward compatible or version it";
            default -> "Fix the " + layer + " failures before proceeding";
        };
    }

    /**
     * 계층의 표준 순서 위치.
     *
     * @param layer 계층 이름
     * @return 순서 (표준 계층이 아니면 가장 뒤)
     */
    public static int orderOf(String layer) {
        int index = ORDER.indexOf(layer);
        return index < 0 ? ORDER.size() : index;
    }

    /**
     * 산출물 기반 계층의 활성화 여부.
     *
     * @param layer 계층 이름
     * @param change 변경
     * @return schema-migration, interface-contract는 해당 산출물이 변경된 경우에만 true
     */
    public static boolean appliesTo(String layer, Change change) {
        return switch (layer) {
            case SCHEMA_MIGRATION -> change.touches(ArtifactKind.SCHEMA_MIGRATION);
            case INTERFACE_CONTRACT -> change.touches(ArtifactKind.INTERFACE_DEFINITION);
            default -> true;
        };
    }
}
