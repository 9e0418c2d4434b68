package io.github.galkahana.testrunner.host;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class ThreadRoutingOutputStreamTest {

    private static void write(ThreadRoutingOutputStream stream, String text) throws Exception {
        stream.write(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDivertedCapture_StaysOffTheConsole() throws Exception {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ThreadRoutingOutputStream stream = new ThreadRoutingOutputStream(console);

        write(stream, "before ");
        stream.begin(true);
        write(stream, "captured");
        String captured = stream.end();
        write(stream, "after");

        assertEquals("captured", captured);
        assertEquals("before after", console.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testPassthroughCapture_AlsoReachesTheConsole() throws Exception {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ThreadRoutingOutputStream stream = new ThreadRoutingOutputStream(console);

        stream.begin(false);
        write(stream, "both");

        assertEquals("both", stream.end());
        assertEquals("both", console.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testCapturesArePerThread() throws Exception {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ThreadRoutingOutputStream stream = new ThreadRoutingOutputStream(console);
        AtomicReference<String> otherCapture = new AtomicReference<>();

        stream.begin(true);
        write(stream, "main ");
        Thread other = new Thread(() -> {
            stream.begin(true);
            try {
                write(stream, "other");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            otherCapture.set(stream.end());
        });
        other.start();
        other.join();
        write(stream, "again");

        assertEquals("main again", stream.end());
        assertEquals("other", otherCapture.get());
        assertEquals("", console.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testEndWithoutBegin_ReturnsEmpty() {
        assertEquals("", new ThreadRoutingOutputStream(new ByteArrayOutputStream()).end());
    }
}
