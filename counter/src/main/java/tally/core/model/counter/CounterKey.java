package tally.core.model.counter;

import java.util.Objects;

/**
 * Identifies one logical velocity counter: a caller-chosen key counted over a
 * trailing window.
 *
 * <p>The same logical key counted over two different windows is two independent
 * counters; the window is part of every bucket key derived from this record.
 *
 * @param logicalKey the caller's key, e.g. {@code acct:123:login_attempts}
 * @param windowSeconds the trailing window length in seconds
 */
public record CounterKey(String logicalKey, double windowSeconds) {

    public CounterKey {
        Objects.requireNonNull(logicalKey, "logicalKey must not be null");
        if (logicalKey.isBlank()) {
            throw new IllegalArgumentException("logicalKey must not be blank");
        }
        if (!isValidWindow(windowSeconds)) {
            throw new IllegalArgumentException("windowSeconds must be finite and positive: " + windowSeconds);
        }
    }

    /**
     * Check whether a key and window would form a valid counter, without throwing.
     *
     * @param logicalKey the caller's key
     * @param windowSeconds the window length in seconds
     * @return true if {@link #CounterKey(String, double)} would accept the arguments
     */
    public static boolean isValid(String logicalKey, double windowSeconds) {
        return logicalKey != null && !logicalKey.isBlank() && isValidWindow(windowSeconds);
    }

    /**
     * Render the window in its canonical key form.
     *
     * <p>Integral windows render without a fractional part ({@code 300}), anything
     * else uses {@link Double#toString(double)} ({@code 0.5}). The rendering is part
     * of the stored key, so it must never change between releases.
     *
     * @return the canonical window label
     */
    public String windowLabel() {
        if (windowSeconds == Math.rint(windowSeconds) && Math.abs(windowSeconds) < 1e15) {
            return Long.toString((long) windowSeconds);
        }
        return Double.toString(windowSeconds);
    }

    private static boolean isValidWindow(double windowSeconds) {
        return Double.isFinite(windowSeconds) && windowSeconds > 0;
    }
}
