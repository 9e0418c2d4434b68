package io.github.galkahana.testrunner;

import java.util.List;

import io.github.galkahana.testrunner.loader.TestCase;

/**
 * Skip globs win over isolate globs; everything else runs in parallel.
 */
public class DefaultClassifier implements Classifier {

    public static final String SKIP_MESSAGE = "skipped by request";

    private final List<String> skipGlobs;
    private final List<String> isolateGlobs;

    public DefaultClassifier(List<String> skipGlobs, List<String> isolateGlobs) {
        this.skipGlobs = List.copyOf(skipGlobs);
        this.isolateGlobs = List.copyOf(isolateGlobs);
    }

    @Override
    public void classify(TestSet testSet, TestCase test) {
        String name = test.id();
        if (Globs.matchesAny(name, skipGlobs)) {
            testSet.getTestsToSkip().add(TestInput.skipped(name, SKIP_MESSAGE));
        } else if (Globs.matchesAny(name, isolateGlobs)) {
            testSet.getIsolatedTests().add(TestInput.of(name));
        } else {
            testSet.getParallelTests().add(TestInput.of(name));
        }
    }
}
