package com.ryuqq.devloop.core.check;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CheckRunner 테스트.
 *
 * <ul>
 *   <li>[A 통과, B 실패, C 통과] → A=PASS, B=FAIL, C=SKIPPED, 전체 FAIL</li>
 *   <li>산출물 기반 계층은 해당 파일이 있을 때만 실행</li>
 *   <li>검증 수준에 따른 계층 선택</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CheckRunnerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final List<String> executed = new ArrayList<>();

    private Check check(String name, boolean passes) {
        return new Check() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String purpose() {
                return "test " + name;
            }

            @Override
            public CheckResult run(Change change) {
                executed.add(name);
                return passes ? CheckResult.pass("ok") : CheckResult.fail(name + " broke");
            }
        };
    }

    private final Change sourceChange = new Change(List.of("src/main/java/App.java"), "+line");

    @Test
    void run_FailureInMiddle_SkipsRemainingLayers() {
        // given
        CheckRunner runner = new CheckRunner(List.of(
            check(StandardLayers.COMPILE, true),
            check(StandardLayers.FORMAT, false),
            check(StandardLayers.TESTS, true)
        ), VerificationLevel.FULL, clock);

        // when
        ValidationRun run = runner.run(sourceChange, 1);

        // then
        assertThat(run.layers()).extracting(LayerResult::outcome)
            .containsExactly(LayerOutcome.PASS, LayerOutcome.FAIL, LayerOutcome.SKIPPED);
        assertThat(run.overall()).isEqualTo(LayerOutcome.FAIL);
        assertThat(executed).containsExactly(StandardLayers.COMPILE, StandardLayers.FORMAT);
        assertThat(run.firstFailure()).get().extracting(LayerResult::name).isEqualTo(StandardLayers.FORMAT);
    }

    @Test
    void run_ChecksGivenOutOfOrder_RunInStandardOrder() {
        CheckRunner runner = new CheckRunner(List.of(
            check(StandardLayers.LINT, true),
            check(StandardLayers.TESTS, true),
            check(StandardLayers.COMPILE, true)
        ), VerificationLevel.FULL, clock);

        ValidationRun run = runner.run(sourceChange, 1);

        assertThat(run.passed()).isTrue();
        assertThat(executed).containsExactly(StandardLayers.COMPILE, StandardLayers.TESTS, StandardLayers.LINT);
    }

    @Test
    void run_SchemaMigrationLayer_OnlyActiveWhenMigrationsChanged() {
        CheckRunner runner = new CheckRunner(List.of(
            check(StandardLayers.COMPILE, true),
            check(StandardLayers.SCHEMA_MIGRATION, true)
        ), VerificationLevel.FULL, clock);

        ValidationRun withoutMigration = runner.run(sourceChange, 1);
        ValidationRun withMigration = runner.run(
            new Change(List.of("db/migration/V2__add_limits.sql"), ""), 2);

        assertThat(withoutMigration.layers()).extracting(LayerResult::name).containsExactly(StandardLayers.COMPILE);
        assertThat(withMigration.layers()).extracting(LayerResult::name)
            .containsExactly(StandardLayers.COMPILE, StandardLayers.SCHEMA_MIGRATION);
    }

    @Test
    void run_QuickLevel_RunsCompileAndStaticGuardsOnly() {
        CheckRunner runner = new CheckRunner(List.of(
            check(StandardLayers.COMPILE, true),
            check(StandardLayers.FORMAT, true),
            check(StandardLayers.STATIC_GUARDS, true),
            check(StandardLayers.TESTS, true),
            check(StandardLayers.LINT, true)
        ), VerificationLevel.QUICK, clock);

        ValidationRun run = runner.run(sourceChange, 1);

        assertThat(run.layers()).extracting(LayerResult::name)
            .containsExactly(StandardLayers.COMPILE, StandardLayers.STATIC_GUARDS);
    }

    @Test
    void run_CheckThrows_RecordedAsFailure() {
        Check exploding = new Check() {
            @Override
            public String name() {
                return StandardLayers.COMPILE;
            }

            @Override
            public String purpose() {
                return "compile";
            }

            @Override
            public CheckResult run(Change change) {
                throw new CheckExecutionException("compiler not found");
            }
        };
        CheckRunner runner = new CheckRunner(List.of(exploding, check(StandardLayers.TESTS, true)),
            VerificationLevel.FULL, clock);

        ValidationRun run = runner.run(sourceChange, 1);

        assertThat(run.layers().get(0).outcome()).isEqualTo(LayerOutcome.FAIL);
        assertThat(run.layers().get(0).output()).contains("compiler not found");
        assertThat(run.layers().get(1).outcome()).isEqualTo(LayerOutcome.SKIPPED);
        assertThat(run.summary()).isEqualTo("iteration 1: compile=FAIL, tests=SKIPPED");
    }

    @Test
    void run_CheckInterrupted_PropagatedWithoutRecordingFailure() {
        Check interrupted = new Check() {
            @Override
            public String name() {
                return StandardLayers.TESTS;
            }

            @Override
            public String purpose() {
                return "tests";
            }

            @Override
            public CheckResult run(Change change) {
                throw new CheckInterruptedException(name(), new InterruptedException("stop"));
            }
        };
        CheckRunner runner = new CheckRunner(List.of(check(StandardLayers.COMPILE, true), interrupted),
            VerificationLevel.FULL, clock);

        assertThatThrownBy(() -> runner.run(sourceChange, 1))
            .isInstanceOf(CheckInterruptedException.class);
        assertThat(executed).containsExactly(StandardLayers.COMPILE);
    }

    @Test
    void run_ExceptionWhileThreadInterrupted_TreatedAsInterruption() {
        Check failing = new Check() {
            @Override
            public String name() {
                return StandardLayers.COMPILE;
            }

            @Override
            public String purpose() {
                return "compile";
            }

            @Override
            public CheckResult run(Change change) {
                Thread.currentThread().interrupt();
                throw new CheckExecutionException("compiler stream closed");
            }
        };
        CheckRunner runner = new CheckRunner(List.of(failing), VerificationLevel.FULL, clock);

        try {
            assertThatThrownBy(() -> runner.run(sourceChange, 1))
                .isInstanceOf(CheckInterruptedException.class)
                .hasCauseInstanceOf(CheckExecutionException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
