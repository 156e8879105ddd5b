package tally.core.service;

import java.time.Duration;
import java.util.OptionalDouble;

import tally.core.model.counter.BucketRange;
import tally.core.model.counter.CounterKey;

/**
 * Maps a counter and a point in time to bucket ids, store keys and TTLs.
 *
 * <p>Bucket width is a step function of the window length so that the number of
 * buckets read per query stays bounded regardless of how long the window is:
 * <ul>
 *   <li>window &le; 5 minutes: 1 second buckets</li>
 *   <li>window &le; 1 hour: 10 second buckets</li>
 *   <li>window &le; 1 day: 1 minute buckets</li>
 *   <li>longer: 10 minute buckets</li>
 * </ul>
 *
 * <p>Key format: {@code {logicalKey}:w{window}:b{bucketId}}. The format is shared
 * by every process that reads or writes the same counters and must stay stable.
 */
public final class BucketKeyScheme {

    private static final double FIVE_MINUTES = 300;
    private static final double ONE_HOUR = 3_600;
    private static final double ONE_DAY = 86_400;

    /**
     * Upper bound on the buckets one window may span. With 600 second buckets this
     * admits windows of up to about 34 days.
     */
    public static final int MAX_BUCKETS = 5_000;

    private BucketKeyScheme() {
        // Utility class - prevent instantiation
    }

    /**
     * Bucket width for a window.
     *
     * @param windowSeconds the window length in seconds
     * @return the bucket width in seconds
     */
    public static long bucketSize(double windowSeconds) {
        if (windowSeconds <= FIVE_MINUTES) {
            return 1;
        }
        if (windowSeconds <= ONE_HOUR) {
            return 10;
        }
        if (windowSeconds <= ONE_DAY) {
            return 60;
        }
        return 600;
    }

    /**
     * Check whether a window spans few enough buckets to be counted.
     *
     * @param windowSeconds the window length in seconds
     * @return true if no query over this window reads more than {@link #MAX_BUCKETS} buckets
     */
    public static boolean withinBucketLimit(double windowSeconds) {
        return Math.ceil(windowSeconds / bucketSize(windowSeconds)) + 1 <= MAX_BUCKETS;
    }

    /**
     * Bucket containing a timestamp.
     *
     * @param epochSeconds the timestamp in (fractional) epoch seconds
     * @param bucketSize the bucket width in seconds
     * @return {@code floor(epochSeconds / bucketSize)}
     */
    public static long bucketId(double epochSeconds, long bucketSize) {
        return (long) Math.floor(epochSeconds / bucketSize);
    }

    /**
     * Store key for one bucket of a counter.
     *
     * @param key the counter
     * @param bucketId the bucket id
     * @return the composite store key
     */
    public static String bucketKey(CounterKey key, long bucketId) {
        return key.logicalKey() + ":w" + key.windowLabel() + ":b" + bucketId;
    }

    /**
     * Buckets covering the window that ends at {@code nowEpochSeconds}.
     *
     * @param nowEpochSeconds the end of the window
     * @param windowSeconds the window length in seconds
     * @return the inclusive bucket range
     */
    public static BucketRange bucketRange(double nowEpochSeconds, double windowSeconds) {
        final var size = bucketSize(windowSeconds);
        return new BucketRange(bucketId(nowEpochSeconds - windowSeconds, size), bucketId(nowEpochSeconds, size), size);
    }

    /**
     * Retention for a newly created bucket.
     *
     * <p>{@code max(window + bucketSize, min(maxTtl ?? 2 * window, 2 * window))}: a bucket
     * always outlives the last window that can read it, and never lives longer than two
     * windows even if the caller asks for more.
     *
     * @param windowSeconds the window length in seconds
     * @param bucketSize the bucket width in seconds
     * @param maxTtlSeconds optional caller-requested upper bound
     * @return the bucket TTL
     */
    public static Duration bucketTtl(double windowSeconds, long bucketSize, OptionalDouble maxTtlSeconds) {
        final var ceiling = windowSeconds * 2;
        final var requested = maxTtlSeconds.isPresent() && !Double.isNaN(maxTtlSeconds.getAsDouble())
                ? maxTtlSeconds.getAsDouble()
                : ceiling;
        final var ttlSeconds = Math.max(windowSeconds + bucketSize, Math.min(requested, ceiling));
        return Duration.ofMillis((long) Math.ceil(ttlSeconds * 1000));
    }
}
