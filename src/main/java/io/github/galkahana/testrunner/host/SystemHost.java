package io.github.galkahana.testrunner.host;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link Host} backed by the running JVM and the local machine.
 */
@Slf4j
public class SystemHost implements Host {

    private static final int DEFAULT_TERMINAL_WIDTH = 80;

    private static ThreadRoutingOutputStream stdoutRouter;
    private static ThreadRoutingOutputStream stderrRouter;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    @Override
    public double time() {
        Instant now = Instant.now();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }

    @Override
    public long getPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public int cpuCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public String getCwd() {
        return Path.of("").toAbsolutePath().toString();
    }

    @Override
    public String separator() {
        return File.separator;
    }

    @Override
    public boolean exists(String... parts) {
        return Files.exists(Path.of(join(parts)));
    }

    @Override
    public boolean isDir(String... parts) {
        return Files.isDirectory(Path.of(join(parts)));
    }

    @Override
    public boolean isFile(String... parts) {
        return Files.isRegularFile(Path.of(join(parts)));
    }

    @Override
    public String join(String... parts) {
        if (parts.length == 0) return "";
        return Path.of(parts[0], Arrays.copyOfRange(parts, 1, parts.length)).toString();
    }

    @Override
    public List<String> listDir(String path) throws IOException {
        try (Stream<Path> entries = Files.list(Path.of(path))) {
            return entries.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Override
    public String readTextFile(String path) throws IOException {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    @Override
    public void writeTextFile(String path, String contents) throws IOException {
        Files.writeString(Path.of(path), contents, StandardCharsets.UTF_8);
    }

    @Override
    public String readStdin() throws IOException {
        return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null ? value : defaultValue;
    }

    @Override
    public boolean stdoutIsTty() {
        return System.console() != null;
    }

    @Override
    public int terminalWidth() {
        String columns = System.getenv("COLUMNS");
        if (columns != null) {
            try {
                return Integer.parseInt(columns.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed COLUMNS value '{}'", columns);
            }
        }
        return DEFAULT_TERMINAL_WIDTH;
    }

    @Override
    public void print(String msg, String end, boolean toStderr) {
        PrintStream stream = toStderr ? System.err : System.out;
        stream.print(msg + end);
        stream.flush();
    }

    @Override
    public void captureOutput(boolean divert) {
        installRouters();
        System.out.flush();
        System.err.flush();
        stdoutRouter.begin(divert);
        stderrRouter.begin(divert);
    }

    @Override
    public CapturedOutput restoreOutput() {
        installRouters();
        System.out.flush();
        System.err.flush();
        return new CapturedOutput(stdoutRouter.end(), stderrRouter.end());
    }

    @Override
    public String fetch(String url, byte[] body, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(request::header);

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode() + " from " + url);
        }
        return response.body();
    }

    private static synchronized void installRouters() {
        if (stdoutRouter != null) return;
        stdoutRouter = new ThreadRoutingOutputStream(System.out);
        stderrRouter = new ThreadRoutingOutputStream(System.err);
        System.setOut(new PrintStream(stdoutRouter, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderrRouter, true, StandardCharsets.UTF_8));
        log.debug("Installed per-thread output routing on stdout/stderr");
    }
}
