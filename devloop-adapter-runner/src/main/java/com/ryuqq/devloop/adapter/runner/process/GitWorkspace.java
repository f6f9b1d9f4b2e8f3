package com.ryuqq.devloop.adapter.runner.process;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.spi.Workspace;
import com.ryuqq.devloop.core.spi.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * git 저장소를 작업 트리로 사용하는 Workspace.
 *
 * <p>{@code git} CLI를 {@link ProcessBuilder}로 실행합니다 (JGit 미사용).</p>
 *
 * <p><strong>마커:</strong> 시작 시점의 작업 트리 전체(커밋되지 않은 수정과 추적되지 않은 파일 포함,
 * ignore 대상 제외)를 HEAD를 부모로 하는 스냅샷 커밋으로 기록하고
 * {@code refs/devloop/markers/<hash>}로 보존합니다. 사용자의 index와 작업 트리는 건드리지 않습니다
 * (임시 index 사용).</p>
 *
 * <p><strong>되돌리기:</strong></p>
 * <ul>
 *   <li>soft: 현재 작업 트리를 {@code refs/devloop/preserved/<n>} 커밋으로 보존한 뒤 마커 상태로 복원</li>
 *   <li>hard: 마커 이후 생긴 파일만 삭제하고 마커 스냅샷을 그대로 복원</li>
 * </ul>
 *
 * <p>복원 후 HEAD와 index는 시작 시점의 HEAD로 돌아가며, 시작 시점의 수정은 unstaged 상태로,
 * 추적되지 않던 파일은 다시 추적되지 않는 상태로 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GitWorkspace implements Workspace {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspace.class);

    static final String PRESERVED_REF_PREFIX = "refs/devloop/preserved/";
    static final String MARKER_REF_PREFIX = "refs/devloop/markers/";

    private static final Map<String, String> SNAPSHOT_IDENTITY = Map.of(
        "GIT_AUTHOR_NAME", "devloop",
        "GIT_AUTHOR_EMAIL", "devloop@localhost",
        "GIT_COMMITTER_NAME", "devloop",
        "GIT_COMMITTER_EMAIL", "devloop@localhost"
    );

    private final Path repository;
    private final Clock clock;

    public GitWorkspace(Path repository, Clock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public StartMarker mark() {
        String head = runGitOutput("rev-parse", "HEAD").strip();
        String branch = runGitOutput("rev-parse", "--abbrev-ref", "HEAD").strip();
        String snapshot = commitWorkingTree(head, "devloop start marker");
        runGitChecked("update-ref", MARKER_REF_PREFIX + snapshot, snapshot);

        if (!runGitOutput("diff", "--name-only", head, snapshot).isBlank()) {
            log.warn("Working tree of {} had uncommitted changes at session start; captured in {}",
                repository, snapshot);
        }
        log.info("Start marker {} on {} (HEAD {})", snapshot, branch, head);
        return new StartMarker(snapshot, branch, clock.instant());
    }

    @Override
    public Change changeSince(StartMarker marker) {
        String reference = requireMarker(marker);
        String current = snapshotTree();
        List<String> paths = lines(runGitOutput("diff", "--no-renames", "--name-only", reference, current));
        String diff = runGitOutput("diff", "--no-renames", reference, current);
        return new Change(paths, diff);
    }

    @Override
    public String softRevert(StartMarker marker) {
        String reference = requireMarker(marker);
        String preserved = commitWorkingTree(reference, "devloop preserved work");
        String preservedRef = PRESERVED_REF_PREFIX + clock.millis();
        runGitChecked("update-ref", preservedRef, preserved);
        restore(reference);
        log.info("Soft revert to {}: current work preserved at {} ({})", reference, preservedRef, preserved);
        return preservedRef;
    }

    @Override
    public void hardRevert(StartMarker marker) {
        String reference = requireMarker(marker);
        restore(reference);
        log.info("Hard revert to {}", reference);
    }

    /**
     * 작업 트리를 마커 스냅샷과 같게 만든 뒤 HEAD와 index를 시작 시점 HEAD로 되돌림.
     */
    private void restore(String reference) {
        String current = snapshotTree();
        for (String added : lines(runGitOutput("diff", "--no-renames", "--name-only", "--diff-filter=A",
            reference, current))) {
            deleteCreatedFile(added);
        }
        runGitChecked("read-tree", "--reset", "-u", reference);
        String baseHead = runGitOutput("rev-parse", reference + "^").strip();
        runGitChecked("reset", "-q", baseHead);
    }

    private void deleteCreatedFile(String relativePath) {
        Path root = repository.toAbsolutePath().normalize();
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root)) {
            throw new WorkspaceException("Refusing to delete a path outside the repository: " + relativePath);
        }
        try {
            Files.deleteIfExists(file);
            Path parent = file.getParent();
            while (parent != null && !parent.equals(root) && isEmptyDirectory(parent)) {
                Files.delete(parent);
                parent = parent.getParent();
            }
        } catch (DirectoryNotEmptyException e) {
            log.debug("Directory not empty, kept: {}", e.getFile());
        } catch (IOException e) {
            throw new WorkspaceException("Cannot delete " + relativePath, e);
        }
    }

    private static boolean isEmptyDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (var entries = Files.list(directory)) {
            return entries.findAny().isEmpty();
        }
    }

    // ============================================================
    // Snapshots
    // ============================================================

    /**
     * 현재 작업 트리 전체를 tree 객체로 기록 (임시 index 사용).
     *
     * @return tree 해시
     */
    String snapshotTree() {
        Path indexDir = null;
        try {
            indexDir = Files.createTempDirectory("devloop-index-");
            Map<String, String> env = Map.of("GIT_INDEX_FILE", indexDir.resolve("index").toString());
            // HEAD에서 시작해야 ignore 대상이지만 추적 중인 파일이 빠지지 않음
            runGitChecked(env, "read-tree", "HEAD");
            runGitChecked(env, "add", "-A");
            return runGitOutput(env, "write-tree").strip();
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create a temporary index", e);
        } finally {
            deleteIndexDir(indexDir);
        }
    }

    private String commitWorkingTree(String parent, String message) {
        String tree = snapshotTree();
        return runGitOutput(SNAPSHOT_IDENTITY, "commit-tree", tree, "-p", parent, "-m", message).strip();
    }

    private static void deleteIndexDir(Path indexDir) {
        if (indexDir == null) {
            return;
        }
        try (var entries = Files.list(indexDir)) {
            for (Path entry : entries.toList()) {
                Files.deleteIfExists(entry);
            }
            Files.deleteIfExists(indexDir);
        } catch (IOException e) {
            log.debug("Could not delete temporary index {}: {}", indexDir, e.getMessage());
        }
    }

    private static String requireMarker(StartMarker marker) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        return marker.reference();
    }

    private static List<String> lines(String output) {
        return output.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
    }

    // ============================================================
    // git process
    // ============================================================

    /**
     * git 명령 실행, 실패 시 예외.
     */
    void runGitChecked(String... args) {
        runGitChecked(Map.of(), args);
    }

    private void runGitChecked(Map<String, String> env, String... args) {
        int exitCode = runGit(env, args);
        if (exitCode != 0) {
            throw new WorkspaceException(
                "git %s failed (exit code %d)".formatted(String.join(" ", args), exitCode));
        }
    }

    int runGit(String... args) {
        return runGit(Map.of(), args);
    }

    private int runGit(Map<String, String> env, String... args) {
        List<String> command = buildCommand(args);
        log.debug("Running: {}", command);
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                .directory(repository.toFile())
                .redirectErrorStream(true);
            builder.environment().putAll(env);
            Process process = builder.start();

            // 출력을 소비해야 프로세스가 멈추지 않음
            try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }
            return process.waitFor();
        } catch (IOException e) {
            throw new WorkspaceException("git command failed: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("git command interrupted: " + command, e);
        }
    }

    String runGitOutput(String... args) {
        return runGitOutput(Map.of(), args);
    }

    private String runGitOutput(Map<String, String> env, String... args) {
        List<String> command = buildCommand(args);
        log.debug("Running (capture): {}", command);
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                .directory(repository.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD);
            builder.environment().putAll(env);
            Process process = builder.start();

            String output;
            try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new WorkspaceException(
                    "git %s failed (exit code %d)".formatted(String.join(" ", args), exitCode));
            }
            return output;
        } catch (IOException e) {
            throw new WorkspaceException("git command failed: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("git command interrupted: " + command, e);
        }
    }

    private static List<String> buildCommand(String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        return command;
    }
}
