package io.github.galkahana.testrunner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.galkahana.testrunner.host.Host;
import lombok.Builder;
import lombok.Value;

/**
 * Every option of a run. Built by {@link ArgumentParser}, or directly by embedders.
 */
@Value
@Builder(toBuilder = true)
public class RunnerArgs {

    public static final String DEFAULT_STATUS_FORMAT = "[%f/%t] ";
    public static final List<String> DEFAULT_SUFFIXES = List.of("*Test", "*Tests");
    public static final List<String> DEFAULT_COVERAGE_OMIT = List.of("*/testrunner/*");

    boolean version;
    boolean help;

    // discovery
    String fileList;
    @Builder.Default
    List<String> tests = List.of();
    @Builder.Default
    List<String> isolate = List.of();
    @Builder.Default
    List<String> skip = List.of();
    @Builder.Default
    List<String> suffixes = DEFAULT_SUFFIXES;
    String topLevelDir;

    // running
    @Builder.Default
    int jobs = 1;
    boolean listOnly;
    boolean dryRun;
    boolean quiet;
    @Builder.Default
    String statusFormat = DEFAULT_STATUS_FORMAT;
    boolean timing;
    int verbose;
    boolean passthrough;
    int retryLimit;
    @Builder.Default
    int terminalWidth = 80;
    boolean overwrite;
    /** JSON text parsed into the shared run context. */
    String context;

    // reporting
    @Builder.Default
    List<String> metadata = List.of();
    String writeFullResultsTo;
    String writeTraceTo;
    String testResultsServer;
    String builderName;
    String masterName;
    String testType;
    boolean coverage;
    @Builder.Default
    List<String> coverageSource = List.of();
    @Builder.Default
    List<String> coverageOmit = DEFAULT_COVERAGE_OMIT;
    boolean coverageShowMissing;

    /** Defaults that depend on the machine: job count, status format, terminal. */
    public static RunnerArgs defaults(Host host) {
        return RunnerArgs.builder()
                .jobs(host.cpuCount())
                .statusFormat(host.getEnv("NINJA_STATUS", DEFAULT_STATUS_FORMAT))
                .terminalWidth(host.terminalWidth())
                .overwrite(host.stdoutIsTty())
                .build();
    }

    /** {@code key=value} metadata entries as a map, in the order given. */
    public Map<String, String> metadataMap() {
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String entry : metadata) {
            int eq = entry.indexOf('=');
            if (eq < 0) throw new IllegalStateException("malformed metadata entry " + entry);
            parsed.put(entry.substring(0, eq), entry.substring(eq + 1));
        }
        return parsed;
    }
}
