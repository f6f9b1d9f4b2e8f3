package com.ryuqq.devloop.adapter.inmemory.workspace;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.spi.Workspace;
import com.ryuqq.devloop.core.spi.WorkspaceException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory implementation of Workspace.
 *
 * <p>Files are held as a sorted path → content map. {@link #mark()} takes a full snapshot;
 * change detection and both revert modes operate against those snapshots.</p>
 *
 * <p><strong>Revert semantics:</strong></p>
 * <ul>
 *   <li>soft: the current state is saved as a new snapshot (its reference is returned), then the marked state is restored</li>
 *   <li>hard: the marked state is restored and the current state is discarded</li>
 * </ul>
 *
 * <p>All methods are synchronized; actors and the orchestrator may touch the workspace concurrently.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkspace implements Workspace {

    private static final String BRANCH = "in-memory";
    private static final String SNAPSHOT_PREFIX = "snapshot-";

    private final Clock clock;
    private final SortedMap<String, byte[]> files = new TreeMap<>();
    private final Map<String, SortedMap<String, byte[]>> snapshots = new HashMap<>();
    private int snapshotSequence;

    public InMemoryWorkspace() {
        this(Clock.systemUTC());
    }

    public InMemoryWorkspace(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    public synchronized void write(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        files.put(path, (content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
    }

    public synchronized void delete(String path) {
        files.remove(path);
    }

    public synchronized Optional<String> read(String path) {
        byte[] content = files.get(path);
        return content == null ? Optional.empty() : Optional.of(new String(content, StandardCharsets.UTF_8));
    }

    public synchronized List<String> files() {
        return List.copyOf(files.keySet());
    }

    @Override
    public synchronized StartMarker mark() {
        return new StartMarker(snapshot(), BRANCH, clock.instant());
    }

    @Override
    public synchronized Change changeSince(StartMarker marker) {
        SortedMap<String, byte[]> base = snapshotOf(marker);

        TreeSet<String> allPaths = new TreeSet<>(base.keySet());
        allPaths.addAll(files.keySet());

        List<String> changed = new ArrayList<>();
        StringBuilder diff = new StringBuilder();
        for (String path : allPaths) {
            byte[] before = base.get(path);
            byte[] after = files.get(path);
            if (before != null && after != null && Arrays.equals(before, after)) {
                continue;
            }
            changed.add(path);
            if (before == null) {
                diff.append("+++ added ").append(path).append('\n');
            } else if (after == null) {
                diff.append("--- deleted ").append(path).append('\n');
            } else {
                diff.append("*** modified ").append(path).append('\n');
            }
            if (after != null) {
                diff.append(new String(after, StandardCharsets.UTF_8)).append('\n');
            }
        }
        return new Change(changed, diff.toString());
    }

    @Override
    public synchronized String softRevert(StartMarker marker) {
        SortedMap<String, byte[]> base = snapshotOf(marker);
        String preserved = snapshot();
        restore(base);
        return preserved;
    }

    @Override
    public synchronized void hardRevert(StartMarker marker) {
        restore(snapshotOf(marker));
    }

    private String snapshot() {
        String reference = SNAPSHOT_PREFIX + (++snapshotSequence);
        snapshots.put(reference, copy(files));
        return reference;
    }

    private SortedMap<String, byte[]> snapshotOf(StartMarker marker) {
        if (marker == null) {
            throw new IllegalArgumentException("marker cannot be null");
        }
        SortedMap<String, byte[]> base = snapshots.get(marker.reference());
        if (base == null || !BRANCH.equals(marker.branch())) {
            throw new WorkspaceException("Unknown start marker: " + marker.reference() + " on " + marker.branch());
        }
        return base;
    }

    private void restore(SortedMap<String, byte[]> base) {
        files.clear();
        files.putAll(copy(base));
    }

    private static SortedMap<String, byte[]> copy(SortedMap<String, byte[]> source) {
        SortedMap<String, byte[]> copy = new TreeMap<>();
        source.forEach((path, content) -> copy.put(path, content.clone()));
        return copy;
    }
}
