package io.github.galkahana.testrunner;

import io.github.galkahana.testrunner.loader.TestCase;

/**
 * Places one discovered test into exactly one bucket of a {@link TestSet}.
 */
@FunctionalInterface
public interface Classifier {
    void classify(TestSet testSet, TestCase test);
}
