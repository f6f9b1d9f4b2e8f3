package com.ryuqq.devloop.core.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 계층형 검증 실행기.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>계층은 표준 순서({@link StandardLayers#ORDER})대로 실행</li>
 *   <li>검증 수준에 포함되지 않거나 변경에 해당하지 않는 계층은 결과에 포함하지 않음</li>
 *   <li>첫 실패 이후의 계층은 SKIPPED</li>
 *   <li>검사 중 발생한 예외는 해당 계층의 FAIL로 기록</li>
 *   <li>인터럽트({@link CheckInterruptedException})는 기록하지 않고 전파</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    private final List<Check> checks;
    private final VerificationLevel level;
    private final Clock clock;

    /**
     * Constructor.
     *
     * @param checks 검사 목록 (순서 무관, 표준 순서로 정렬됨)
     * @param level 검증 수준
     * @param clock 시계
     */
    public CheckRunner(List<Check> checks, VerificationLevel level, Clock clock) {
        if (checks == null) {
            throw new IllegalArgumentException("checks cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        long distinct = checks.stream().map(Check::name).distinct().count();
        if (distinct != checks.size()) {
            throw new IllegalArgumentException("Check names must be unique");
        }
        this.checks = checks.stream()
            .sorted(Comparator.comparingInt(check -> StandardLayers.orderOf(check.name())))
            .toList();
        this.level = level;
        this.clock = clock;
    }

    /**
     * 변경에 대해 검증 실행.
     *
     * @param change 검증 대상 변경
     * @param iteration 세션 내 검증 회차
     * @return 검증 실행 결과
     * @throws CheckInterruptedException 검사 중 인터럽트된 경우
     */
    public ValidationRun run(Change change, int iteration) {
        Instant startedAt = clock.instant();
        List<LayerResult> results = new ArrayList<>();
        boolean failed = false;

        for (Check check : checks) {
            if (!level.includes(check.level()) || !check.appliesTo(change)) {
                continue;
            }
            if (failed) {
                results.add(LayerResult.skipped(check.name()));
                continue;
            }
            LayerResult result = execute(check, change);
            results.add(result);
            if (result.outcome() == LayerOutcome.FAIL) {
                failed = true;
                log.info("Validation iteration {} failed at layer {}", iteration, check.name());
            }
        }

        return new ValidationRun(iteration, results, startedAt, clock.instant());
    }

    private LayerResult execute(Check check, Change change) {
        Instant start = clock.instant();
        CheckResult result;
        try {
            result = check.run(change);
        } catch (CheckInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CheckInterruptedException(check.name(), e);
            }
            log.error("Check {} threw an exception", check.name(), e);
            result = CheckResult.fail("Check '" + check.name() + "' could not run: " + e.getMessage());
        }
        Duration elapsed = Duration.between(start, clock.instant());
        LayerOutcome outcome = result.passed() ? LayerOutcome.PASS : LayerOutcome.FAIL;
        return new LayerResult(check.name(), outcome, result.output(), check.hint(), elapsed);
    }

    public VerificationLevel level() {
        return level;
    }

    public List<String> layerNames() {
        return checks.stream().map(Check::name).toList();
    }
}
