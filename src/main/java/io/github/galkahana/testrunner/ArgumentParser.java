package io.github.galkahana.testrunner;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.results.Json;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Turns command-line arguments into {@link RunnerArgs} and rejects inconsistent combinations.
 */
public class ArgumentParser {

    static final String PROG = "testrunner";

    private final Host host;
    private final Options options = buildOptions();

    public ArgumentParser(Host host) {
        this.host = host;
    }

    public RunnerArgs parse(String[] argv) throws ConfigurationException {
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, argv);
        } catch (ParseException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        RunnerArgs defaults = RunnerArgs.defaults(host);
        int verbose = (int) Arrays.stream(cmd.getOptions()).filter(o -> "v".equals(o.getOpt())).count();

        RunnerArgs.RunnerArgsBuilder args = defaults.toBuilder()
                .version(cmd.hasOption("version"))
                .help(cmd.hasOption("help"))
                .fileList(cmd.getOptionValue("file-list"))
                .tests(cmd.getArgList())
                .isolate(values(cmd, "isolate"))
                .skip(values(cmd, "skip"))
                .topLevelDir(cmd.getOptionValue("top-level-dir"))
                .jobs(intValue(cmd, "jobs", defaults.getJobs()))
                .listOnly(cmd.hasOption("list-only"))
                .dryRun(cmd.hasOption("dry-run"))
                .quiet(cmd.hasOption("quiet"))
                .statusFormat(cmd.getOptionValue("status-format", defaults.getStatusFormat()))
                .timing(cmd.hasOption("timing"))
                .verbose(verbose)
                .passthrough(cmd.hasOption("passthrough"))
                .retryLimit(intValue(cmd, "retry-limit", 0))
                .terminalWidth(intValue(cmd, "terminal-width", defaults.getTerminalWidth()))
                .context(cmd.getOptionValue("context"))
                .metadata(values(cmd, "metadata"))
                .writeFullResultsTo(cmd.getOptionValue("write-full-results-to"))
                .writeTraceTo(cmd.getOptionValue("write-trace-to"))
                .testResultsServer(cmd.getOptionValue("test-results-server"))
                .builderName(cmd.getOptionValue("builder-name"))
                .masterName(cmd.getOptionValue("master-name"))
                .testType(cmd.getOptionValue("test-type"))
                .coverage(cmd.hasOption("coverage"))
                .coverageSource(values(cmd, "coverage-source"))
                .coverageShowMissing(cmd.hasOption("coverage-show-missing"));

        List<String> suffixes = values(cmd, "suffixes");
        if (!suffixes.isEmpty()) args.suffixes(suffixes);
        List<String> omit = values(cmd, "coverage-omit");
        if (!omit.isEmpty()) args.coverageOmit(omit);

        if (cmd.hasOption("overwrite")) {
            args.overwrite(true);
        } else if (cmd.hasOption("no-overwrite")) {
            args.overwrite(false);
        } else {
            args.overwrite(host.stdoutIsTty() && verbose == 0);
        }

        // Console passthrough and coverage both need tests to run one at a time.
        if (cmd.hasOption("passthrough") || cmd.hasOption("coverage")) {
            args.jobs(1);
        }

        RunnerArgs parsed = args.build();
        validate(parsed);
        return parsed;
    }

    public String usage() {
        StringWriter text = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(text), HelpFormatter.DEFAULT_WIDTH,
                PROG + " [options] [tests...]", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        return text.toString();
    }

    private static void validate(RunnerArgs args) throws ConfigurationException {
        List<String> errors = new ArrayList<>();
        for (String entry : args.getMetadata()) {
            if (!entry.contains("=")) errors.add("malformed --metadata \"" + entry + "\"");
        }
        if (args.getTestResultsServer() != null) {
            if (args.getBuilderName() == null) errors.add("--builder-name must be specified along with --test-results-server");
            if (args.getMasterName() == null) errors.add("--master-name must be specified along with --test-results-server");
            if (args.getTestType() == null) errors.add("--test-type must be specified along with --test-results-server");
        }
        if (args.getJobs() < 1) errors.add("--jobs must be at least 1");
        if (args.getRetryLimit() < 0) errors.add("--retry-limit must not be negative");
        if (args.getContext() != null) {
            try {
                Json.parse(args.getContext());
            } catch (JsonProcessingException e) {
                errors.add("malformed --context: " + e.getOriginalMessage());
            }
        }
        if (!errors.isEmpty()) throw new ConfigurationException(errors);
    }

    private static List<String> values(CommandLine cmd, String name) {
        String[] values = cmd.getOptionValues(name);
        return values == null ? List.of() : List.of(values);
    }

    private static int intValue(CommandLine cmd, String name, int defaultValue) throws ConfigurationException {
        String value = cmd.getOptionValue(name);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " expects an integer, got \"" + value + "\"", e);
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption("V", "version", false, "Print the version and exit.");
        options.addOption("h", "help", false, "Print this help and exit.");

        // discovery
        options.addOption(Option.builder("f").longOpt("file-list").hasArg().argName("FILENAME")
                .desc("Takes the list of tests from the file (use \"-\" for stdin).").build());
        options.addOption(repeatable("isolate", "glob", "Globs of tests to run in isolation (serially)."));
        options.addOption(repeatable("skip", "glob", "Globs of test names to skip (can specify multiple times)."));
        options.addOption(repeatable("suffixes", "glob",
                "Globs of test group names to look for (defaults to " + RunnerArgs.DEFAULT_SUFFIXES + ")."));
        options.addOption(Option.builder().longOpt("top-level-dir").hasArg().argName("DIR")
                .desc("Sets the top directory of the project (used when running subdirs).").build());

        // running
        options.addOption(Option.builder("j").longOpt("jobs").hasArg().argName("N")
                .desc("Runs N jobs in parallel (defaults to the number of CPUs).").build());
        options.addOption("l", "list-only", false, "Lists all the test names found and exits.");
        options.addOption("n", "dry-run", false, "Resolves tests without running them.");
        options.addOption("q", "quiet", false, "Runs as quietly as possible (only prints errors).");
        options.addOption(Option.builder("s").longOpt("status-format").hasArg().argName("FORMAT")
                .desc("Format of the progress prefix (defaults to $NINJA_STATUS or \"" + RunnerArgs.DEFAULT_STATUS_FORMAT + "\").").build());
        options.addOption("t", "timing", false, "Prints timing info.");
        options.addOption("v", "verbose", false, "Prints more stuff (can specify multiple times for more output).");
        options.addOption(null, "passthrough", false, "Prints all output while running (forces -j 1).");
        options.addOption(Option.builder().longOpt("retry-limit").hasArg().argName("N")
                .desc("Retries each failure up to N times.").build());
        options.addOption(Option.builder().longOpt("terminal-width").hasArg().argName("N")
                .desc("Width used to elide progress lines.").build());
        options.addOption(null, "overwrite", false, "Rewrites the progress line in place.");
        options.addOption(null, "no-overwrite", false, "Prints each progress line on its own line.");
        options.addOption(Option.builder().longOpt("context").hasArg().argName("JSON")
                .desc("JSON value shared with every test as its context.").build());

        // reporting
        options.addOption(repeatable("metadata", "key=value", "Optional key=value metadata that will be included in the results."));
        options.addOption(Option.builder().longOpt("write-full-results-to").hasArg().argName("FILENAME")
                .desc("If specified, writes the full results to that path.").build());
        options.addOption(Option.builder().longOpt("write-trace-to").hasArg().argName("FILENAME")
                .desc("If specified, writes the trace to that path.").build());
        options.addOption(Option.builder().longOpt("test-results-server").hasArg().argName("HOST")
                .desc("If specified, uploads the full results to this server.").build());
        options.addOption(Option.builder().longOpt("builder-name").hasArg().argName("NAME")
                .desc("Builder name to include in the uploaded data.").build());
        options.addOption(Option.builder().longOpt("master-name").hasArg().argName("NAME")
                .desc("Master name to include in the uploaded data.").build());
        options.addOption(Option.builder().longOpt("test-type").hasArg().argName("TYPE")
                .desc("Name of test type to include in the uploaded data.").build());
        options.addOption("c", "coverage", false, "Reports coverage information (forces -j 1).");
        options.addOption(repeatable("coverage-source", "dir",
                "Directories to include when reporting coverage (defaults to --top-level-dir)."));
        options.addOption(repeatable("coverage-omit", "glob",
                "Globs to omit when reporting coverage (defaults to " + RunnerArgs.DEFAULT_COVERAGE_OMIT + ")."));
        options.addOption(null, "coverage-show-missing", false, "Shows lines not covered.");
        return options;
    }

    private static Option repeatable(String longOpt, String argName, String description) {
        return Option.builder().longOpt(longOpt).hasArg().argName(argName).desc(description).build();
    }
}
