package io.github.galkahana.testrunner.host;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Access to the outside world: clock, process identity, filesystem, environment,
 * console output and the network.
 * <p>
 * Everything the runner needs from the machine goes through this interface so that
 * the engine can be exercised against an in-memory fake.
 */
public interface Host {

    /** Wall-clock time in seconds since the epoch. */
    double time();

    long getPid();

    int cpuCount();

    String getCwd();

    String separator();

    boolean exists(String... parts);

    boolean isDir(String... parts);

    boolean isFile(String... parts);

    String join(String... parts);

    /** Names of the entries directly below {@code path}, sorted. */
    List<String> listDir(String path) throws IOException;

    String readTextFile(String path) throws IOException;

    void writeTextFile(String path, String contents) throws IOException;

    /** Everything remaining on standard input. */
    String readStdin() throws IOException;

    /** Value of an environment variable, or {@code defaultValue} when unset. */
    String getEnv(String name, String defaultValue);

    boolean stdoutIsTty();

    int terminalWidth();

    void print(String msg, String end, boolean toStderr);

    default void print(String msg) {
        print(msg, "\n", false);
    }

    /**
     * Start capturing output written by the calling thread.
     *
     * @param divert when false the output is also passed through to the real console
     */
    void captureOutput(boolean divert);

    /** Stop capturing output for the calling thread and return what was captured. */
    CapturedOutput restoreOutput();

    /**
     * POST {@code body} to {@code url}.
     *
     * @return the response body
     * @throws IOException on transport failure or a non-2xx status
     */
    String fetch(String url, byte[] body, Map<String, String> headers) throws IOException, InterruptedException;
}
