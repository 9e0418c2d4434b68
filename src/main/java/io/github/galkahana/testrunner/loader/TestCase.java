package io.github.galkahana.testrunner.loader;

/**
 * One runnable unit of work.
 * <p>
 * The body signals its outcome through how it returns: normal return is a pass, an
 * {@link AssertionError} is a failure, {@link SkipTestException} is a skip and any other
 * exception is an error. A case that {@link #expectedToFail() expects to fail} turns a failure
 * or error into an expected failure and a normal return into an unexpected success.
 */
public interface TestCase {

    /** Fully qualified, dotted identifier. Unique within a run. */
    String id();

    void run(TestContext context) throws Exception;

    default boolean expectedToFail() {
        return false;
    }
}
