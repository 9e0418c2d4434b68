package io.github.galkahana.testrunner;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

import io.github.galkahana.testrunner.results.ResultType;

/**
 * A test to be run (or skipped), identified by name.
 *
 * @param name dotted test id
 * @param message why the test is skipped, empty otherwise
 * @param timeout optional time limit, null when unset
 * @param expected optional expected outcomes, empty when unset
 */
public record TestInput(String name, String message, Duration timeout, Set<ResultType> expected) {

    public TestInput {
        Objects.requireNonNull(name, "name");
        message = message == null ? "" : message;
        expected = expected == null ? Set.of() : Set.copyOf(expected);
    }

    public static TestInput of(String name) {
        return new TestInput(name, "", null, Set.of());
    }

    public static TestInput skipped(String name, String message) {
        return new TestInput(name, message, null, Set.of());
    }
}
