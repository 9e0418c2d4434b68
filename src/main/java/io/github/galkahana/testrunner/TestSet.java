package io.github.galkahana.testrunner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.github.galkahana.testrunner.pool.WorkerHooks;
import lombok.Getter;

/**
 * The tests of one pass, split into the three buckets that decide how each one runs.
 * <p>
 * Buckets are filled during classification and sorted by name before the pass starts.
 * The {@code context} is shared read-only by every worker; {@code hooks} run once per worker.
 */
@Getter
public class TestSet {

    private final List<TestInput> parallelTests;
    private final List<TestInput> isolatedTests;
    private final List<TestInput> testsToSkip;
    private final Object context;
    private final WorkerHooks hooks;

    public TestSet(Object context, WorkerHooks hooks) {
        this(List.of(), List.of(), List.of(), context, hooks);
    }

    public TestSet(List<TestInput> parallelTests, List<TestInput> isolatedTests, List<TestInput> testsToSkip,
                   Object context, WorkerHooks hooks) {
        this.parallelTests = new ArrayList<>(parallelTests);
        this.isolatedTests = new ArrayList<>(isolatedTests);
        this.testsToSkip = new ArrayList<>(testsToSkip);
        this.context = context;
        this.hooks = hooks != null ? hooks : WorkerHooks.NONE;
        sort();
    }

    /** A set whose only bucket is the isolated one, for re-running tests one at a time. */
    public static TestSet isolated(List<String> names, Object context, WorkerHooks hooks) {
        List<TestInput> inputs = names.stream().map(TestInput::of).collect(Collectors.toList());
        return new TestSet(List.of(), inputs, List.of(), context, hooks);
    }

    public void sort() {
        Comparator<TestInput> byName = Comparator.comparing(TestInput::name);
        parallelTests.sort(byName);
        isolatedTests.sort(byName);
        testsToSkip.sort(byName);
    }

    public int size() {
        return parallelTests.size() + isolatedTests.size() + testsToSkip.size();
    }

    public boolean hasTestsToRun() {
        return !parallelTests.isEmpty() || !isolatedTests.isEmpty();
    }

    /** Names from every bucket, sorted. */
    public List<String> allTestNames() {
        return Stream.of(parallelTests, isolatedTests, testsToSkip)
                .flatMap(List::stream)
                .map(TestInput::name)
                .sorted()
                .collect(Collectors.toList());
    }
}
