package io.github.galkahana.testrunner.coverage;

import java.io.IOException;
import java.util.List;

import io.github.galkahana.testrunner.host.Host;

/**
 * Hooks into a code-coverage tool. One collector is created per worker; the runner asks for the
 * combined report once all workers have saved their data.
 */
public interface CoverageSupport {

    CoverageCollector newCollector(List<String> sources);

    /** Erase data left over from earlier runs. */
    void erase() throws IOException;

    /** Combine the saved per-worker data and print a report through {@code host}. */
    void report(Host host, List<String> omit, boolean showMissing) throws IOException;
}
