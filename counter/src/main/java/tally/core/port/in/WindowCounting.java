package tally.core.port.in;

import java.util.OptionalDouble;

/**
 * Use case for sliding-window velocity counters.
 *
 * <p>Both operations fail open: on any store failure they return 0 and never throw.
 * A 0 result therefore means "no events" or "store unavailable"; callers cannot
 * tell the two apart.
 */
public interface WindowCounting {

    /**
     * Record one occurrence of {@code key} now and return the window total.
     *
     * @param key the logical counter key
     * @param windowSeconds the trailing window in seconds
     * @param maxTtlSeconds optional upper bound on bucket retention; never lowers it below
     *     {@code windowSeconds + bucketSize} and never raises it above {@code 2 * windowSeconds}
     * @return the best-effort total including this occurrence, or 0 on failure
     */
    long increment(String key, double windowSeconds, OptionalDouble maxTtlSeconds);

    /**
     * Record one occurrence using the default bucket retention.
     *
     * @param key the logical counter key
     * @param windowSeconds the trailing window in seconds
     * @return the best-effort total including this occurrence, or 0 on failure
     */
    default long increment(String key, double windowSeconds) {
        return increment(key, windowSeconds, OptionalDouble.empty());
    }

    /**
     * Count occurrences of {@code key} in the trailing window without recording one.
     *
     * @param key the logical counter key
     * @param windowSeconds the trailing window in seconds
     * @return the best-effort total, or 0 on failure
     */
    long query(String key, double windowSeconds);
}
