package io.github.galkahana.testrunner.host;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Output stream that sends each thread's writes either to the real console or, while that
 * thread has a capture open, into a buffer owned by the thread.
 * <p>
 * Installed behind {@code System.out} and {@code System.err} so concurrent workers can each
 * capture what their current unit prints without seeing each other's output.
 */
final class ThreadRoutingOutputStream extends OutputStream {

    private final OutputStream console;
    private final ThreadLocal<Capture> capture = new ThreadLocal<>();

    private static final class Capture {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final boolean divert;

        Capture(boolean divert) {
            this.divert = divert;
        }
    }

    ThreadRoutingOutputStream(OutputStream console) {
        this.console = console;
    }

    void begin(boolean divert) {
        capture.set(new Capture(divert));
    }

    String end() {
        Capture current = capture.get();
        capture.remove();
        return current == null ? "" : current.buffer.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void write(int b) throws IOException {
        Capture current = capture.get();
        if (current == null) {
            console.write(b);
            return;
        }
        current.buffer.write(b);
        if (!current.divert) console.write(b);
    }

    @Override
    public void write(byte[] bytes, int off, int len) throws IOException {
        Capture current = capture.get();
        if (current == null) {
            console.write(bytes, off, len);
            return;
        }
        current.buffer.write(bytes, off, len);
        if (!current.divert) console.write(bytes, off, len);
    }

    @Override
    public void flush() throws IOException {
        console.flush();
    }
}
