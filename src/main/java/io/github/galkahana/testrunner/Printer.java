package io.github.galkahana.testrunner;

import io.github.galkahana.testrunner.host.Host;

/**
 * Writes progress lines, optionally rewriting the current terminal line in place.
 */
public class Printer {

    private final Host host;
    private final int columns;
    private boolean shouldOverwrite;
    private String lastLine = "";

    public Printer(Host host, boolean shouldOverwrite, int columns) {
        this.host = host;
        this.shouldOverwrite = shouldOverwrite;
        this.columns = columns;
    }

    public void setShouldOverwrite(boolean shouldOverwrite) {
        this.shouldOverwrite = shouldOverwrite;
    }

    public boolean isShouldOverwrite() {
        return shouldOverwrite;
    }

    /** Terminate a pending progress line. */
    public void flush() {
        if (!lastLine.isEmpty()) {
            lastLine = "";
            host.print("");
        }
    }

    /**
     * Replace (or follow) the previous progress line with {@code msg}.
     *
     * @param elide shorten the middle of {@code msg} so it fits on one terminal line
     */
    public void update(String msg, boolean elide) {
        int limit = columns - 5;
        if (elide && limit > 3 && msg.length() > limit) {
            int keep = limit / 2;
            msg = msg.substring(0, keep) + "..." + msg.substring(msg.length() - keep);
        }
        if (shouldOverwrite && !lastLine.isEmpty()) {
            host.print("\r" + " ".repeat(lastLine.length()) + "\r", "", false);
        } else if (!lastLine.isEmpty()) {
            host.print("");
        }
        host.print(msg, "", false);
        lastLine = msg.substring(msg.lastIndexOf('\n') + 1);
    }
}
