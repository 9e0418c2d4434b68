package io.github.galkahana.testrunner.coverage;

import java.io.IOException;

/**
 * Coverage recording for a single worker.
 */
public interface CoverageCollector {

    void start();

    void stop();

    void save() throws IOException;
}
