package io.github.galkahana.testrunner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.galkahana.testrunner.coverage.CoverageSupport;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.host.SystemHost;
import io.github.galkahana.testrunner.loader.LoadException;
import io.github.galkahana.testrunner.loader.Loader;
import io.github.galkahana.testrunner.loader.ServiceLoaderLoader;
import io.github.galkahana.testrunner.loader.TestCase;
import io.github.galkahana.testrunner.pool.TestExecutor;
import io.github.galkahana.testrunner.pool.WorkerHooks;
import io.github.galkahana.testrunner.pool.WorkerPool;
import io.github.galkahana.testrunner.pool.WorkerPools;
import io.github.galkahana.testrunner.pool.WorkerSpec;
import io.github.galkahana.testrunner.results.FullResults;
import io.github.galkahana.testrunner.results.Json;
import io.github.galkahana.testrunner.results.Result;
import io.github.galkahana.testrunner.results.ResultSet;
import io.github.galkahana.testrunner.results.TraceBuilder;
import io.github.galkahana.testrunner.results.UploadRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a whole test session: discover and classify tests, run them on worker pools, retry the
 * failures, then summarize and write the result artifacts.
 * <p>
 * The runner itself is single-threaded. It blocks while draining a pool and is the only thread
 * that touches {@link Stats} and the {@link ResultSet}; workers only hand back results.
 */
@Slf4j
public class Runner {

    public static final String VERSION = "1.0.0";
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION_ERROR = 2;
    public static final int EXIT_INTERRUPTED = 130;

    private final Host host;
    private final Loader loader;

    private RunnerArgs args;
    private CoverageSupport coverage;
    private Printer printer;
    private Stats stats;
    private String topLevelDir;
    private int verbose;

    private static final class DiscoveryException extends Exception {
        DiscoveryException(String message) {
            super(message);
        }
    }

    private record TestsOutcome(int exitCode, ObjectNode fullResults) {
    }

    public Runner() {
        this(new SystemHost(), new ServiceLoaderLoader());
    }

    public Runner(Host host, Loader loader) {
        this.host = host;
        this.loader = loader;
        this.args = RunnerArgs.defaults(host);
    }

    public RunnerArgs getArgs() {
        return args;
    }

    public void setArgs(RunnerArgs args) {
        this.args = args;
    }

    /** Coverage tool used when {@code --coverage} is given. */
    public void setCoverage(CoverageSupport coverage) {
        this.coverage = coverage;
    }

    /**
     * Parse {@code argv} and run.
     *
     * @return process exit code
     */
    public int main(String[] argv) {
        ArgumentParser parser = new ArgumentParser(host);
        try {
            args = parser.parse(argv);
        } catch (ConfigurationException e) {
            e.getErrors().forEach(error -> host.print("Error: " + error, "\n", true));
            return EXIT_CONFIGURATION_ERROR;
        }
        if (args.isHelp()) {
            host.print(parser.usage(), "", false);
            return EXIT_OK;
        }

        try {
            return run().exitCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            host.print("interrupted, exiting", "\n", true);
            return EXIT_INTERRUPTED;
        }
    }

    public RunOutcome run() throws InterruptedException {
        return run(null, null, null, null);
    }

    /**
     * Run a session.
     *
     * @param testSet tests to run; discovered from the arguments when null
     * @param classifier bucket policy for discovered tests; skip/isolate globs when null
     * @param context shared run context; parsed from {@code --context} when null
     * @param hooks per-worker setup and teardown; none when null
     */
    public RunOutcome run(TestSet testSet, Classifier classifier, Object context, WorkerHooks hooks)
            throws InterruptedException {
        if (args.isVersion()) {
            print(VERSION);
            return new RunOutcome(EXIT_OK, null, null);
        }

        int ret = setUpRunner();
        if (ret != EXIT_OK) return new RunOutcome(ret, null, null);

        double findStart = host.time();
        if (args.isCoverage()) eraseCoverage();

        ResultSet resultSet = new ResultSet();
        if (testSet == null) {
            try {
                testSet = findTests(classifier, context != null ? context : parseContext(), hooks);
            } catch (DiscoveryException e) {
                print(e.getMessage());
                ret = EXIT_FAILURE;
            }
        }
        double findEnd = host.time();

        ObjectNode fullResults = null;
        if (ret == EXIT_OK) {
            TestsOutcome outcome = runTests(resultSet, testSet);
            ret = outcome.exitCode();
            fullResults = outcome.fullResults();
        }
        double testEnd = host.time();

        TraceBuilder traceBuilder = new TraceBuilder(stats.getStartedTime(), host.getPid());
        ObjectNode trace = traceBuilder.fromResults(resultSet, args.metadataMap());
        if (fullResults != null) {
            summarize(fullResults);
            boolean written = writeArtifact(args.getWriteFullResultsTo(), fullResults, "full results");
            int uploadRet = uploadResults(fullResults);
            if (ret == EXIT_OK) ret = uploadRet;
            double reportingEnd = host.time();
            traceBuilder.addPhase(trace, "run", findStart, reportingEnd);
            traceBuilder.addPhase(trace, "discovery", findStart, findEnd);
            traceBuilder.addPhase(trace, "testing", findEnd, testEnd);
            traceBuilder.addPhase(trace, "reporting", testEnd, reportingEnd);
            written &= writeArtifact(args.getWriteTraceTo(), trace, "trace");
            reportCoverage();
            if (ret == EXIT_OK && !written) ret = EXIT_FAILURE;
        }
        return new RunOutcome(ret, fullResults, trace);
    }

    private int setUpRunner() {
        stats = new Stats(args.getStatusFormat(), host::time, args.getJobs());
        printer = new Printer(host, args.isOverwrite(), args.getTerminalWidth());
        verbose = args.getVerbose();
        topLevelDir = args.getTopLevelDir() != null ? absolute(args.getTopLevelDir()).toString() : host.getCwd();

        if (args.isCoverage() && coverage == null) {
            host.print("Error: coverage was requested but no coverage support is configured");
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private Object parseContext() {
        if (args.getContext() == null) return null;
        try {
            return Json.parse(args.getContext());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("--context was validated but does not parse", e);
        }
    }

    // discovery

    private TestSet findTests(Classifier classifier, Object context, WorkerHooks hooks) throws DiscoveryException {
        TestSet testSet = new TestSet(context, hooks);
        Classifier policy = classifier != null ? classifier : new DefaultClassifier(args.getSkip(), args.getIsolate());
        Set<String> seen = new HashSet<>();

        for (String name : nameListFromArgs()) {
            List<TestCase> found;
            try {
                found = loadTests(name);
            } catch (LoadException | RuntimeException e) {
                log.debug("Discovery of {} failed", name, e);
                throw new DiscoveryException("Failed to load \"" + name + "\": " + e.getMessage());
            }
            for (TestCase test : found) {
                if (seen.add(test.id())) policy.classify(testSet, test);
            }
        }
        testSet.sort();
        log.debug("Discovered {} parallel, {} isolated, {} skipped tests", testSet.getParallelTests().size(),
                testSet.getIsolatedTests().size(), testSet.getTestsToSkip().size());
        return testSet;
    }

    private List<String> nameListFromArgs() throws DiscoveryException {
        if (!args.getTests().isEmpty()) return args.getTests();
        if (args.getFileList() == null) return List.of(".");

        String contents;
        try {
            contents = "-".equals(args.getFileList()) ? host.readStdin() : host.readTextFile(args.getFileList());
        } catch (IOException e) {
            throw new DiscoveryException("Failed to read test list \"" + args.getFileList() + "\": " + e.getMessage());
        }
        List<String> names = new ArrayList<>();
        for (String line : contents.split("\\R")) {
            if (!line.isBlank()) names.add(line.strip());
        }
        return names;
    }

    private List<TestCase> loadTests(String name) throws LoadException {
        if (host.isFile(name)) {
            String relative = absolute(topLevelDir).relativize(absolute(name)).toString();
            if (relative.endsWith(".java")) relative = relative.substring(0, relative.length() - ".java".length());
            return loader.loadTestsFromName(relative.replace(host.separator(), "."));
        }
        if (host.isDir(name)) {
            return discover(absolute(name).toString());
        }
        String possibleDir = name.replace(".", host.separator());
        if (host.isDir(topLevelDir, possibleDir)) {
            return discover(host.join(topLevelDir, possibleDir));
        }
        return loader.loadTestsFromName(name);
    }

    private Path absolute(String path) {
        return Path.of(host.getCwd()).resolve(path).normalize();
    }

    private List<TestCase> discover(String dir) throws LoadException {
        List<TestCase> found = new ArrayList<>();
        for (String suffix : args.getSuffixes()) {
            found.addAll(loader.discover(dir, suffix, topLevelDir));
        }
        return found;
    }

    // execution

    private TestsOutcome runTests(ResultSet resultSet, TestSet testSet) throws InterruptedException {
        if (!testSet.hasTestsToRun()) {
            print("No tests to run.");
            return new TestsOutcome(EXIT_FAILURE, null);
        }

        List<String> allTests = testSet.allTestNames();
        if (args.isListOnly()) {
            print(String.join("\n", allTests));
            return new TestsOutcome(EXIT_OK, null);
        }

        runOneSet(stats, resultSet, testSet);

        RetryController retries = new RetryController(args.getRetryLimit());
        retries.run(resultSet, (attempt, failed) -> {
            print("");
            print(String.format("Retrying failed tests (attempt #%d of %d)...", attempt, args.getRetryLimit()));
            print("");

            Stats retryStats = new Stats(args.getStatusFormat(), host::time, 1);
            TestSet retrySet = TestSet.isolated(new ArrayList<>(failed), testSet.getContext(), testSet.getHooks());
            ResultSet retryResults = new ResultSet();
            runOneSet(retryStats, retryResults, retrySet);
            return retryResults;
        }, () -> {
            printer.flush();
            printer.setShouldOverwrite(false);
            verbose = Math.min(verbose, 1);
        });
        if (retries.getAttemptsRun() > 0) print("");

        ObjectNode fullResults = FullResults.make(args.metadataMap(), (long) host.time(), allTests, resultSet, false);
        return new TestsOutcome(FullResults.exitCode(fullResults), fullResults);
    }

    private void runOneSet(Stats stats, ResultSet resultSet, TestSet testSet) throws InterruptedException {
        stats.setTotal(testSet.size());
        skipTests(stats, resultSet, testSet.getTestsToSkip());
        runList(stats, resultSet, testSet, testSet.getParallelTests(), args.getJobs());
        runList(stats, resultSet, testSet, testSet.getIsolatedTests(), 1);
    }

    private void skipTests(Stats stats, ResultSet resultSet, List<TestInput> testsToSkip) {
        for (TestInput input : testsToSkip) {
            double last = host.time();
            stats.testStarted();
            printTestStarted(stats, input);
            double now = host.time();
            Result result = Result.skipped(input.name(), input.message(), last, now - last, host.getPid());
            resultSet.add(result);
            stats.testFinished();
            printTestFinished(stats, result);
        }
    }

    private void runList(Stats stats, ResultSet resultSet, TestSet testSet, List<TestInput> inputs, int jobs)
            throws InterruptedException {
        jobs = Math.min(inputs.size(), jobs);
        if (jobs == 0) return;

        Deque<TestInput> pending = new ArrayDeque<>(inputs);
        Set<String> running = new HashSet<>();
        WorkerPool pool = WorkerPools.make(host, jobs, workerSpec(testSet), new TestExecutor());
        try {
            while (!pending.isEmpty() || !running.isEmpty()) {
                while (!pending.isEmpty() && running.size() < jobs) {
                    TestInput input = pending.poll();
                    stats.testStarted();
                    pool.send(input);
                    running.add(input.name());
                    printTestStarted(stats, input);
                }

                Result result = pool.get();
                running.remove(result.name());
                resultSet.add(result);
                stats.testFinished();
                printTestFinished(stats, result);
            }
            pool.close();
        } finally {
            pool.join();
        }
    }

    private WorkerSpec workerSpec(TestSet testSet) {
        List<String> sources = args.getCoverageSource().isEmpty() ? List.of(topLevelDir) : args.getCoverageSource();
        return WorkerSpec.builder()
                .loader(loader)
                .context(testSet.getContext())
                .hooks(testSet.getHooks())
                .dryRun(args.isDryRun())
                .passthrough(args.isPassthrough())
                .coverage(args.isCoverage() ? coverage : null)
                .coverageSources(sources)
                .build();
    }

    // progress

    private void printTestStarted(Stats stats, TestInput input) {
        if (!args.isQuiet() && printer.isShouldOverwrite()) {
            printer.update(stats.format() + input.name(), verbose == 0);
        }
    }

    private void printTestFinished(Stats stats, Result result) {
        stats.addTime();

        String resultStr = switch (result.actual()) {
            case FAILURE -> " failed";
            case SKIP -> " was skipped";
            case PASS -> " passed";
        };
        if (result.unexpected()) resultStr += " unexpectedly";
        String timingStr = args.isTiming() ? String.format(Locale.ROOT, " %.4fs", result.took()) : "";
        String suffix = resultStr + timingStr;
        boolean hasOutput = !result.out().isEmpty() || !result.err().isEmpty();

        if (result.code() != 0) {
            if (hasOutput) suffix += ":\n";
            printer.update(stats.format() + result.name() + suffix, false);
            printIndented(result);
        } else if (!args.isQuiet()) {
            if (verbose > 1 && hasOutput) suffix += ":\n";
            printer.update(stats.format() + result.name() + suffix, verbose == 0);
            if (verbose > 1) printIndented(result);
            if (verbose > 0) printer.flush();
        }
    }

    private void printIndented(Result result) {
        for (String line : result.out().split("\\R")) {
            if (!line.isEmpty()) print("  " + line);
        }
        for (String line : result.err().split("\\R")) {
            if (!line.isEmpty()) print("  " + line);
        }
    }

    private void summarize(ObjectNode fullResults) {
        int numTests = stats.getFinished();
        int numFailures = FullResults.numFailures(fullResults);
        if (args.isQuiet() && numFailures == 0) return;

        String timingClause = args.isTiming()
                ? String.format(Locale.ROOT, " in %.1fs", host.time() - stats.getStartedTime())
                : "";
        printer.update(String.format("%d test%s run%s, %d failure%s.",
                numTests, numTests == 1 ? "" : "s",
                timingClause,
                numFailures, numFailures == 1 ? "" : "s"), false);
        printer.flush();
    }

    private void print(String msg) {
        host.print(msg);
    }

    // artifacts

    private boolean writeArtifact(String path, ObjectNode document, String what) {
        if (path == null) return true;
        try {
            host.writeTextFile(path, Json.pretty(document));
            log.debug("Wrote {} to {}", what, path);
            return true;
        } catch (IOException e) {
            log.error("Failed to write {} to {}", what, path, e);
            host.print("Failed to write " + what + " to " + path + ": " + e.getMessage(), "\n", true);
            return false;
        }
    }

    private int uploadResults(ObjectNode fullResults) throws InterruptedException {
        if (args.getTestResultsServer() == null) return EXIT_OK;

        UploadRequest request = UploadRequest.make(args.getTestResultsServer(), args.getBuilderName(),
                args.getMasterName(), args.getTestType(), fullResults);
        try {
            host.fetch(request.url(), request.body(), Map.of("Content-Type", request.contentType()));
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            log.warn("Upload to {} failed", request.url(), e);
            host.print("Uploading the JSON results raised \"" + e.getMessage() + "\"");
            return EXIT_FAILURE;
        }
    }

    private void eraseCoverage() {
        try {
            coverage.erase();
        } catch (IOException e) {
            log.warn("Could not erase earlier coverage data", e);
        }
    }

    private void reportCoverage() {
        if (!args.isCoverage()) return;
        host.print("");
        try {
            coverage.report(host, args.getCoverageOmit(), args.isCoverageShowMissing());
        } catch (IOException e) {
            log.error("Coverage report failed", e);
            host.print("Coverage report failed: " + e.getMessage(), "\n", true);
        }
    }
}
