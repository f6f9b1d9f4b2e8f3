package com.ryuqq.devloop.testkit.scripted;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.check.Check;
import com.ryuqq.devloop.core.check.CheckResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Check stub with a scripted sequence of results.
 *
 * <p>Each run consumes the next scripted result. Once the script is exhausted the last
 * result repeats.</p>
 *
 * <pre>
 * StubCheck tests = StubCheck.sequence("tests", false, true);  // fails once, then passes
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StubCheck implements Check {

    private final String name;
    private final List<Boolean> script;
    private final AtomicInteger runs = new AtomicInteger();
    private final List<Change> seenChanges = new ArrayList<>();

    private StubCheck(String name, List<Boolean> script) {
        if (script.isEmpty()) {
            throw new IllegalArgumentException("script cannot be empty");
        }
        this.name = name;
        this.script = List.copyOf(script);
    }

    public static StubCheck passing(String name) {
        return new StubCheck(name, List.of(true));
    }

    public static StubCheck failing(String name) {
        return new StubCheck(name, List.of(false));
    }

    public static StubCheck sequence(String name, Boolean... results) {
        return new StubCheck(name, List.of(results));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String purpose() {
        return "stub " + name;
    }

    @Override
    public CheckResult run(Change change) {
        int index = runs.getAndIncrement();
        synchronized (seenChanges) {
            seenChanges.add(change);
        }
        boolean passed = script.get(Math.min(index, script.size() - 1));
        return passed
            ? CheckResult.pass(name + " ok")
            : CheckResult.fail(name + " failed on run " + (index + 1));
    }

    /**
     * Number of times this check has been executed.
     *
     * @return run count
     */
    public int runs() {
        return runs.get();
    }

    public List<Change> seenChanges() {
        synchronized (seenChanges) {
            return List.copyOf(seenChanges);
        }
    }
}
