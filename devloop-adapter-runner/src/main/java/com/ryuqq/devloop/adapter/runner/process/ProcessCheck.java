package com.ryuqq.devloop.adapter.runner.process;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.check.Check;
import com.ryuqq.devloop.core.check.CheckExecutionException;
import com.ryuqq.devloop.core.check.CheckInterruptedException;
import com.ryuqq.devloop.core.check.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 외부 명령을 실행하는 검증 계층.
 *
 * <p>종료 코드 0이면 PASS, 그 외는 FAIL입니다. stdout과 stderr를 합친 출력이 결과에 담깁니다.
 * 제한 시간을 넘기면 프로세스를 강제 종료하고 FAIL로 보고합니다.</p>
 *
 * <p>프로세스를 시작할 수 없는 경우(명령 없음 등)는 {@link CheckExecutionException}을 던지며,
 * CheckRunner가 이를 해당 계층의 FAIL로 기록합니다. 대기 중 인터럽트되면 프로세스를 종료하고
 * 인터럽트 플래그를 복원한 뒤 {@link CheckInterruptedException}을 던집니다.</p>
 *
 * <pre>
 * Check compile = new ProcessCheck("compile", "Code compiles",
 *     List.of("mvn", "-q", "compile"), repository, Duration.ofMinutes(10));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcessCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(ProcessCheck.class);

    private final String name;
    private final String purpose;
    private final List<String> command;
    private final Path workDir;
    private final Duration timeout;

    public ProcessCheck(String name, String purpose, List<String> command, Path workDir, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (purpose == null) {
            throw new IllegalArgumentException("purpose cannot be null");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be null or empty");
        }
        if (workDir == null) {
            throw new IllegalArgumentException("workDir cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.name = name;
        this.purpose = purpose;
        this.command = List.copyOf(command);
        this.workDir = workDir;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String purpose() {
        return purpose;
    }

    @Override
    public CheckResult run(Change change) {
        log.debug("Running {}: {}", name, command);
        Path output = null;
        try {
            output = Files.createTempFile("devloop-" + name + "-", ".log");
            Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return CheckResult.fail("Timed out after " + timeout + "\n" + readOutput(output));
            }

            String text = readOutput(output);
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return CheckResult.pass(text);
            }
            return CheckResult.fail("Exit code " + exitCode + "\n" + text);
        } catch (IOException e) {
            throw new CheckExecutionException("Cannot run " + name + " (" + String.join(" ", command) + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckInterruptedException(name, e);
        } finally {
            deleteQuietly(output);
        }
    }

    /**
     * 도구 출력 읽기. UTF-8이 아닌 바이트는 치환 문자로 바꿉니다.
     */
    private static String readOutput(Path output) throws IOException {
        return new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path output) {
        if (output == null) {
            return;
        }
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", output, e.getMessage());
        }
    }
}
