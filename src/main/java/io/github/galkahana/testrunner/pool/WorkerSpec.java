package io.github.galkahana.testrunner.pool;

import java.util.List;

import io.github.galkahana.testrunner.coverage.CoverageSupport;
import io.github.galkahana.testrunner.loader.Loader;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings every worker of a pool starts from. Shared read-only by all workers.
 */
@Value
@Builder(toBuilder = true)
public class WorkerSpec {

    @NonNull
    Loader loader;

    /** Shared run context, handed to {@link WorkerHooks#setUp}. May be null. */
    Object context;

    @NonNull
    @Builder.Default
    WorkerHooks hooks = WorkerHooks.NONE;

    boolean dryRun;

    /** Let test output through to the console instead of capturing it. */
    boolean passthrough;

    /** Null when coverage is not being collected. */
    CoverageSupport coverage;

    @NonNull
    @Builder.Default
    List<String> coverageSources = List.of();
}
