package io.github.galkahana.testrunner;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.function.DoubleSupplier;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Progress counters for one pass over a test set, rendered through a Ninja-style status format.
 * <p>
 * Format directives: {@code %s} started, {@code %t} total, {@code %r} running, {@code %u}
 * not yet started, {@code %f} finished, {@code %p} percent finished, {@code %e} elapsed seconds,
 * {@code %o} overall rate, {@code %c} rate over the most recent completions, {@code %%} a
 * literal percent sign.
 * <p>
 * Only the thread draining results touches an instance.
 */
@Getter
public class Stats {

    private final String statusFormat;
    private final double startedTime;
    private int total;
    private int started;
    private int finished;

    @Getter(AccessLevel.NONE)
    private final DoubleSupplier clock;
    @Getter(AccessLevel.NONE)
    private final int windowSize;
    @Getter(AccessLevel.NONE)
    private final Deque<Double> completionTimes = new ArrayDeque<>();

    /**
     * @param statusFormat template rendered by {@link #format()}
     * @param clock wall-clock seconds
     * @param windowSize number of recent completions used for the current rate
     */
    public Stats(String statusFormat, DoubleSupplier clock, int windowSize) {
        this.statusFormat = statusFormat;
        this.clock = clock;
        this.windowSize = windowSize;
        this.startedTime = clock.getAsDouble();
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public void testStarted() {
        started++;
    }

    public void testFinished() {
        finished++;
    }

    /** Record a completion time for the current-rate window. */
    public void addTime() {
        if (windowSize <= 0) return;
        completionTimes.addLast(clock.getAsDouble());
        while (completionTimes.size() > windowSize) {
            completionTimes.removeFirst();
        }
    }

    public String format() {
        StringBuilder out = new StringBuilder();
        int p = 0;
        int end = statusFormat.length();
        while (p < end) {
            char c = statusFormat.charAt(p);
            if (c == '%' && p < end - 1) {
                char directive = statusFormat.charAt(p + 1);
                switch (directive) {
                    case 'c' -> out.append(currentRate());
                    case 'e' -> out.append(String.format(Locale.ROOT, "%-5.3f", elapsed()));
                    case 'f' -> out.append(finished);
                    case 'o' -> out.append(overallRate());
                    case 'p' -> out.append(percentFinished());
                    case 'r' -> out.append(started - finished);
                    case 's' -> out.append(started);
                    case 't' -> out.append(total);
                    case 'u' -> out.append(total - started);
                    case '%' -> out.append('%');
                    default -> out.append(c).append(directive);
                }
                p += 2;
            } else {
                out.append(c);
                p++;
            }
        }
        return out.toString();
    }

    private double elapsed() {
        return clock.getAsDouble() - startedTime;
    }

    private String overallRate() {
        double elapsed = elapsed();
        if (finished == 0 || elapsed <= 0) return "-";
        return String.format(Locale.ROOT, "%5.1f", finished / elapsed);
    }

    private String currentRate() {
        if (completionTimes.size() < 2) return "-";
        double span = completionTimes.peekLast() - completionTimes.peekFirst();
        if (span <= 0) return "-";
        return String.format(Locale.ROOT, "%5.1f", (completionTimes.size() - 1) / span);
    }

    private String percentFinished() {
        if (total == 0) return "-";
        return String.format(Locale.ROOT, "%5.1f%%", finished * 100.0 / total);
    }
}
