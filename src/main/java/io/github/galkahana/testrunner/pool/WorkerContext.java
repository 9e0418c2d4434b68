package io.github.galkahana.testrunner.pool;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.github.galkahana.testrunner.coverage.CoverageCollector;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.loader.TestContext;
import io.github.galkahana.testrunner.loader.TestGroup;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * State private to one worker for its whole lifetime. Never shared between workers.
 */
@Getter
public class WorkerContext implements TestContext {

    private final Host host;
    private final int workerNum;
    private final WorkerSpec spec;

    @Setter(AccessLevel.PACKAGE)
    private Object contextAfterSetup;

    @Setter(AccessLevel.PACKAGE)
    private CoverageCollector coverageCollector;

    /** Groups looked up while resolving tests by walking their names. Empty means not found. */
    private final Map<String, Optional<TestGroup>> loadedGroups = new HashMap<>();

    public WorkerContext(Host host, int workerNum, WorkerSpec spec) {
        this.host = host;
        this.workerNum = workerNum;
        this.spec = spec;
        this.contextAfterSetup = spec.getContext();
    }

    @Override
    public int workerNum() {
        return workerNum;
    }

    @Override
    public Host host() {
        return host;
    }

    @Override
    public Object context() {
        return contextAfterSetup;
    }
}
