package io.github.galkahana.testrunner.loader;

/**
 * Thrown from a test body to mark the test as skipped.
 */
public class SkipTestException extends RuntimeException {

    public SkipTestException(String reason) {
        super(reason);
    }
}
