package io.github.galkahana.testrunner;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.galkahana.testrunner.coverage.CoverageCollector;
import io.github.galkahana.testrunner.coverage.CoverageSupport;
import io.github.galkahana.testrunner.host.FakeHost;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.loader.ScriptedCase;
import io.github.galkahana.testrunner.loader.FakeTestGroup;
import io.github.galkahana.testrunner.loader.ServiceLoaderLoader;
import io.github.galkahana.testrunner.loader.TestGroup;
import io.github.galkahana.testrunner.pool.WorkerContext;
import io.github.galkahana.testrunner.pool.WorkerHooks;
import io.github.galkahana.testrunner.results.Json;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunnerTest {

    private final FakeHost host = new FakeHost();

    private int run(List<TestGroup> groups, String... argv) {
        return new Runner(host, new ServiceLoaderLoader(groups)).main(argv);
    }

    private static List<TestGroup> passingPair() {
        return List.of(FakeTestGroup.of("pkg.FooTest",
                ScriptedCase.passing("pkg.FooTest.a"), ScriptedCase.passing("pkg.FooTest.b")));
    }

    private JsonNode fullResults(String path) throws Exception {
        return Json.parse(host.file(path));
    }

    @Test
    public void testAllPass_ExitsZero() throws Exception {
        int exitCode = run(passingPair(), "pkg.FooTest", "--write-full-results-to", "full.json");

        assertEquals(0, exitCode);
        String out = host.stdout();
        assertTrue(out.contains("pkg.FooTest.a passed"), out);
        assertTrue(out.contains("pkg.FooTest.b passed"), out);
        assertTrue(out.endsWith("2 tests run, 0 failures.\n"), out);

        JsonNode full = fullResults("full.json");
        assertEquals(3, full.get("version").asInt());
        assertEquals(0, full.at("/num_failures_by_type/FAIL").asInt());
        assertEquals(2, full.at("/num_failures_by_type/PASS").asInt());
        assertEquals("PASS", full.at("/tests/pkg/FooTest/a/actual").asText());
    }

    @Test
    public void testFailure_ExitsOneAndShowsTheTrace() throws Exception {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest",
                ScriptedCase.passing("pkg.FooTest.a"), ScriptedCase.failing("pkg.FooTest.b")));

        int exitCode = run(groups, "pkg.FooTest", "--write-full-results-to", "full.json");

        assertEquals(1, exitCode);
        String out = host.stdout();
        assertTrue(out.contains("pkg.FooTest.b failed unexpectedly:\n"), out);
        assertTrue(out.contains("  java.lang.AssertionError: pkg.FooTest.b is broken"), out);
        assertTrue(out.endsWith("2 tests run, 1 failure.\n"), out);
        assertTrue(fullResults("full.json").at("/tests/pkg/FooTest/b/is_unexpected").asBoolean());
    }

    @Test
    public void testFlakyTest_PassesOnRetry() throws Exception {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest",
                ScriptedCase.passing("pkg.FooTest.a"), ScriptedCase.flaky("pkg.FooTest.b", 1)));

        int exitCode = run(groups, "pkg.FooTest", "--retry-limit", "3", "--write-full-results-to", "full.json");

        assertEquals(0, exitCode);
        String out = host.stdout();
        assertTrue(out.contains("Retrying failed tests (attempt #1 of 3)..."), out);
        assertFalse(out.contains("attempt #2"), out);

        JsonNode leaf = fullResults("full.json").at("/tests/pkg/FooTest/b");
        assertEquals("FAIL PASS", leaf.get("actual").asText());
        assertTrue(leaf.get("is_flaky").asBoolean());
        assertEquals(2, leaf.get("times").size());
    }

    @Test
    public void testStackOverflow_FailsOnlyThatTest() {
        for (String jobs : List.of("1", "2")) {
            // Arrange
            FakeHost jobsHost = new FakeHost();
            List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest",
                    ScriptedCase.of("pkg.FooTest.a", context -> {
                        throw new StackOverflowError("deep");
                    }),
                    ScriptedCase.passing("pkg.FooTest.b"), ScriptedCase.passing("pkg.FooTest.c")));

            // Act
            int exitCode = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> new Runner(jobsHost, new ServiceLoaderLoader(groups)).main(new String[] {"pkg.FooTest", "-j", jobs}));

            // Assert
            String out = jobsHost.stdout();
            assertEquals(1, exitCode, "-j " + jobs);
            assertTrue(out.contains("java.lang.StackOverflowError: deep"), out);
            assertTrue(out.contains("pkg.FooTest.b passed"), out);
            assertTrue(out.contains("pkg.FooTest.c passed"), out);
            assertTrue(out.endsWith("3 tests run, 1 failure.\n"), out);
        }
    }

    @Test
    public void testFullResults_StampedWithTheEndOfTheRun() throws Exception {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest",
                ScriptedCase.of("pkg.FooTest.slow", context -> host.advance(500))));

        run(groups, "pkg.FooTest.slow", "--write-full-results-to", "full.json");

        assertTrue(fullResults("full.json").get("seconds_since_epoch").asLong() >= 1_700_000_500L);
    }

    @Test
    public void testPersistentFailure_UsesEveryRetry() {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest", ScriptedCase.failing("pkg.FooTest.b")));

        int exitCode = run(groups, "pkg.FooTest.b", "--retry-limit", "2");

        assertEquals(1, exitCode);
        assertTrue(host.stdout().contains("Retrying failed tests (attempt #2 of 2)..."));
    }

    @Test
    public void testSkippedTests_AreReportedFirst() throws Exception {
        int exitCode = run(passingPair(), "pkg.FooTest", "--skip", "*.b", "--write-full-results-to", "full.json");

        assertEquals(0, exitCode);
        String out = host.stdout();
        assertTrue(out.startsWith("[1/2] pkg.FooTest.b was skipped"), out);
        assertEquals(1, fullResults("full.json").at("/num_failures_by_type/SKIP").asInt());
    }

    @Test
    public void testIsolatedTests_RunAfterParallelOnes() throws Exception {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.FooTest",
                ScriptedCase.passing("pkg.FooTest.a"), ScriptedCase.passing("pkg.FooTest.b"),
                ScriptedCase.passing("pkg.FooTest.c")));

        int exitCode = run(groups, "pkg.FooTest", "--isolate", "*.a", "-j", "2", "--write-trace-to", "trace.json");

        assertEquals(0, exitCode);
        JsonNode events = Json.parse(host.file("trace.json")).get("traceEvents");
        assertEquals("pkg.FooTest.a", events.get(2).get("name").asText());
        assertEquals(1, events.get(2).get("tid").asInt());
        List<String> phases = new ArrayList<>();
        for (int i = 3; i < events.size(); i++) {
            phases.add(events.get(i).get("name").asText());
        }
        assertEquals(List.of("run", "discovery", "testing", "reporting"), phases);
    }

    @Test
    public void testOnlySkippedTests_NothingToRun() {
        int exitCode = run(passingPair(), "pkg.FooTest", "--skip", "*");

        assertEquals(1, exitCode);
        assertEquals("No tests to run.\n", host.stdout());
    }

    @Test
    public void testUnknownName_FailsDiscovery() {
        int exitCode = run(passingPair(), "nope.Missing");

        assertEquals(1, exitCode);
        assertEquals("Failed to load \"nope.Missing\": no test or group named nope.Missing\n", host.stdout());
    }

    @Test
    public void testListOnly_PrintsSortedNames() {
        int exitCode = run(passingPair(), "-l", "pkg.FooTest.b", "pkg.FooTest");

        assertEquals(0, exitCode);
        assertEquals("pkg.FooTest.a\npkg.FooTest.b\n", host.stdout());
    }

    @Test
    public void testFileList_FromFileAndStdin() {
        host.withFile("tests.txt", "pkg.FooTest.a\n\n").withStdin("pkg.FooTest.b\n");

        assertEquals(0, run(passingPair(), "-f", "tests.txt"));
        assertTrue(host.stdout().endsWith("1 test run, 0 failures.\n"), host.stdout());

        assertEquals(0, run(passingPair(), "-f", "-"));
        assertTrue(host.stdout().contains("pkg.FooTest.b passed"), host.stdout());
    }

    @Test
    public void testNoNames_DiscoversFromCurrentDirectory() {
        List<TestGroup> groups = List.of(
                FakeTestGroup.of("pkg.FooTest", ScriptedCase.passing("pkg.FooTest.a")),
                FakeTestGroup.of("pkg.Helper", ScriptedCase.failing("pkg.Helper.not_a_test")));

        int exitCode = run(groups);

        assertEquals(0, exitCode);
        assertTrue(host.stdout().endsWith("1 test run, 0 failures.\n"), host.stdout());
    }

    @Test
    public void testQuiet_PrintsNothingOnSuccess() {
        assertEquals(0, run(passingPair(), "-q", "pkg.FooTest"));
        assertEquals("", host.stdout());
    }

    @Test
    public void testTiming_AddsDurations() {
        assertEquals(0, run(passingPair(), "-t", "-j", "1", "pkg.FooTest"));

        String out = host.stdout();
        assertTrue(out.contains("pkg.FooTest.a passed 0.0000s"), out);
        assertTrue(out.endsWith("2 tests run in 0.0s, 0 failures.\n"), out);
    }

    @Test
    public void testContext_ReachesEveryTest() {
        List<TestGroup> groups = List.of(FakeTestGroup.of("pkg.CtxTest", ScriptedCase.of("pkg.CtxTest.a", context -> {
            JsonNode shared = (JsonNode) context.context();
            if (shared.get("answer").asInt() != 42) throw new AssertionError("wrong context " + shared);
        })));

        assertEquals(0, run(groups, "--context", "{\"answer\": 42}", "pkg.CtxTest"));
    }

    @Test
    public void testUpload_PostsFullResults() {
        int exitCode = run(passingPair(), "pkg.FooTest", "--test-results-server", "results.example.com",
                "--builder-name", "linux", "--master-name", "main", "--test-type", "unit");

        assertEquals(0, exitCode);
        assertEquals(1, host.requests().size());
        FakeHost.Request request = host.requests().get(0);
        assertEquals("http://results.example.com/testfile/upload", request.url());
        assertTrue(request.headers().get("Content-Type").startsWith("multipart/form-data; boundary="));
        assertTrue(request.body().contains("\"version\" : 3"));
    }

    @Test
    public void testUploadFailure_ExitsOneButKeepsArtifacts() {
        host.failingFetch(new IOException("connection refused"));

        int exitCode = run(passingPair(), "pkg.FooTest", "--write-full-results-to", "full.json",
                "--test-results-server", "results.example.com",
                "--builder-name", "linux", "--master-name", "main", "--test-type", "unit");

        assertEquals(1, exitCode);
        assertTrue(host.stdout().contains("Uploading the JSON results raised \"connection refused\""), host.stdout());
        assertNotNull(host.file("full.json"));
    }

    @Test
    public void testConfigurationError_ExitsTwoBeforeRunning() {
        int exitCode = run(passingPair(), "--metadata", "foo", "pkg.FooTest");

        assertEquals(2, exitCode);
        assertEquals("Error: malformed --metadata \"foo\"\n", host.stderr());
        assertEquals("", host.stdout());
    }

    @Test
    public void testVersionAndHelp() {
        assertEquals(0, run(passingPair(), "--version"));
        assertEquals(Runner.VERSION + "\n", host.stdout());

        assertEquals(0, run(passingPair(), "-h"));
        assertTrue(host.stdout().contains("usage: " + ArgumentParser.PROG));
    }

    @Test
    public void testCoverage_WithoutSupportFails() {
        assertEquals(1, run(passingPair(), "--coverage", "pkg.FooTest"));
        assertTrue(host.stdout().contains("coverage was requested"));
    }

    @Test
    public void testCoverage_ReportsAfterTheRun() {
        List<String> events = new ArrayList<>();
        Runner runner = new Runner(host, new ServiceLoaderLoader(passingPair()));
        runner.setCoverage(new CoverageSupport() {
            @Override
            public CoverageCollector newCollector(List<String> sources) {
                return new CoverageCollector() {
                    @Override
                    public void start() {
                        events.add("start");
                    }

                    @Override
                    public void stop() {
                        events.add("stop");
                    }

                    @Override
                    public void save() {
                        events.add("save");
                    }
                };
            }

            @Override
            public void erase() {
                events.add("erase");
            }

            @Override
            public void report(Host reportHost, List<String> omit, boolean showMissing) {
                events.add("report:" + omit);
                reportHost.print("TOTAL 100%");
            }
        });

        int exitCode = runner.main(new String[] {"--coverage", "pkg.FooTest"});

        assertEquals(0, exitCode);
        assertEquals(List.of("erase", "start", "stop", "save", "report:" + RunnerArgs.DEFAULT_COVERAGE_OMIT), events);
        assertTrue(host.stdout().endsWith("TOTAL 100%\n"));
    }

    @Test
    public void testEmbedding_WithExplicitTestSetAndHooks() throws Exception {
        Runner runner = new Runner(host, new ServiceLoaderLoader(passingPair()));
        runner.setArgs(runner.getArgs().toBuilder().jobs(2).build());
        List<String> setUps = new ArrayList<>();
        TestSet testSet = new TestSet(List.of(TestInput.of("pkg.FooTest.a"), TestInput.of("pkg.FooTest.b")),
                List.of(), List.of(), "ctx", new WorkerHooks() {
                    @Override
                    public Object setUp(WorkerContext worker, Object context) {
                        synchronized (setUps) {
                            setUps.add(context + "@" + worker.getWorkerNum());
                        }
                        return context;
                    }
                });

        RunOutcome outcome = runner.run(testSet, null, null, null);

        assertEquals(0, outcome.exitCode());
        assertEquals(2, outcome.fullResults().at("/num_failures_by_type/PASS").asInt());
        assertEquals(2, setUps.size());
        assertTrue(setUps.containsAll(List.of("ctx@1", "ctx@2")));
    }
}
