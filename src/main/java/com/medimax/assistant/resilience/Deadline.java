package com.medimax.assistant.resilience;

import java.time.Duration;

/**
 * Wall-clock budget of one request. Every outbound attempt and backoff sleep
 * is capped by what is left of it.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration budget) {
        long now = System.nanoTime();
        long nanos = budget.toNanos();
        return new Deadline(Long.MAX_VALUE - now < nanos ? Long.MAX_VALUE : now + nanos);
    }

    public static Deadline none() {
        return NONE;
    }

    public Duration remaining() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    /**
     * The smaller of {@code timeout} and the remaining budget, never below 1ms.
     */
    public Duration cap(Duration timeout) {
        Duration remaining = remaining();
        Duration capped = remaining.compareTo(timeout) < 0 ? remaining : timeout;
        return capped.isZero() ? Duration.ofMillis(1) : capped;
    }
}
