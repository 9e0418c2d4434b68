package io.github.galkahana.testrunner.loader;

import java.util.List;

/**
 * A named collection of test cases, e.g. all the tests of one class.
 * <p>
 * Implementations are discovered through {@link java.util.ServiceLoader} by
 * {@link ServiceLoaderLoader}; register them in
 * {@code META-INF/services/io.github.galkahana.testrunner.loader.TestGroup}.
 */
public interface TestGroup {

    /** Dotted group name. Member ids normally start with it. */
    String name();

    List<TestCase> tests();
}
