package io.github.galkahana.testrunner.loader;

import java.util.List;
import java.util.Optional;

/**
 * Locates test cases by name.
 */
public interface Loader {

    /**
     * Resolve a dotted name to the test cases it denotes. A group name yields all of its
     * members, a test id yields that single test.
     *
     * @throws LoadException if nothing is known under the name
     */
    List<TestCase> loadTestsFromName(String name) throws LoadException;

    /**
     * Find all test cases below {@code startDir} whose group matches the glob {@code pattern}.
     *
     * @param topLevelDir directory that dotted names are relative to
     */
    List<TestCase> discover(String startDir, String pattern, String topLevelDir) throws LoadException;

    /** The group registered under exactly {@code name}, if there is one. */
    Optional<TestGroup> loadGroup(String name);
}
