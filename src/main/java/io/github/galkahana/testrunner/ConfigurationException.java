package io.github.galkahana.testrunner;

import java.util.List;

/**
 * The requested options cannot be used together, or one of them is malformed.
 * Detected before anything runs.
 */
public class ConfigurationException extends Exception {

    private final List<String> errors;

    public ConfigurationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    /** One line per problem found. */
    public List<String> getErrors() {
        return errors;
    }
}
