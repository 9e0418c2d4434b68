package io.github.galkahana.testrunner;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What a run produced.
 *
 * @param exitCode process exit code
 * @param fullResults full-results document, null when no tests ran
 * @param trace trace document, null when the run stopped before discovery
 */
public record RunOutcome(int exitCode, ObjectNode fullResults, ObjectNode trace) {
}
