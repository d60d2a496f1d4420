package io.generativeai.client;

import java.time.Duration;

/**
 * A point in monotonic time, fixed when a call starts.
 */
final class Deadline {

    // far enough away to be treated as "never" without overflowing nanoTime arithmetic
    private static final long MAX_NANOS = Long.MAX_VALUE / 2;

    private final Duration timeout;
    private final long deadlineNanos;

    private Deadline(Duration timeout, long startNanos) {
        this.timeout = timeout;
        this.deadlineNanos = startNanos + toNanosCapped(timeout);
    }

    static Deadline after(Duration timeout) {
        return new Deadline(timeout, System.nanoTime());
    }

    Duration timeout() {
        return timeout;
    }

    /** Nanoseconds left, never negative. */
    long remainingNanos() {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    boolean expired() {
        return remainingNanos() == 0L;
    }

    private static long toNanosCapped(Duration d) {
        if (d.compareTo(Duration.ofNanos(MAX_NANOS)) >= 0) return MAX_NANOS;
        return d.toNanos();
    }
}
