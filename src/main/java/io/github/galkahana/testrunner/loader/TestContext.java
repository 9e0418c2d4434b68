package io.github.galkahana.testrunner.loader;

import io.github.galkahana.testrunner.host.Host;

/**
 * What a running {@link TestCase} may see of the worker executing it.
 */
public interface TestContext {

    /** Ordinal of the worker running the case, starting at 1. */
    int workerNum();

    Host host();

    /** Shared run context as transformed by the worker's setup hook. Read-only. */
    Object context();
}
