package io.github.galkahana.testrunner.loader;

/**
 * A name could not be resolved to any test case.
 */
public class LoadException extends Exception {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
