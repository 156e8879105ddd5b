package tally.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tally.core.model.counter.CounterKey;
import tally.core.model.counter.CounterOutcome;
import tally.core.model.store.CounterStoreException;
import tally.core.model.store.FailureAction;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.StoreOperation;
import tally.core.model.store.TouchResult;
import tally.core.port.in.WindowCounting;
import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;

/**
 * Approximate sliding-window counter over fixed-width buckets in a shared store.
 *
 * <p>An increment adds one to the bucket containing "now"; a query sums every
 * bucket overlapping the window. All coordination between concurrent callers,
 * in this process or others, goes through the store's atomic increment and
 * add-if-absent. There are no local locks and no local state.
 *
 * <p>Failure handling follows {@link StoreFailurePolicy}:
 * <ul>
 *   <li>a failed increment falls back to add-if-absent, then one more increment</li>
 *   <li>a failed batched read degrades to per-key reads</li>
 *   <li>an undecodable or unreadable bucket is skipped</li>
 *   <li>anything else returns 0 with an error metric and a log line</li>
 * </ul>
 *
 * <p>Known approximation: when the store cannot touch a key, the TTL of a new
 * bucket is assigned by overwriting it with the count just observed. An increment
 * from another caller landing between the two calls is lost. This can happen at
 * most once per bucket.
 */
@ApplicationScoped
public class SlidingWindowCounter implements WindowCounting {

    private static final Logger LOG = Logger.getLogger(SlidingWindowCounter.class);

    private static final long FIRST_OCCURRENCE = 1;

    private final AtomicCounterStore store;
    private final CounterMetrics metrics;
    private final Clock clock;
    private final StoreFailurePolicy policy;

    @Inject
    public SlidingWindowCounter(AtomicCounterStore store, CounterMetrics metrics, Clock clock) {
        this(store, metrics, clock, StoreFailurePolicy.standard());
    }

    public SlidingWindowCounter(
            AtomicCounterStore store, CounterMetrics metrics, Clock clock, StoreFailurePolicy policy) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.policy = policy;
    }

    @Override
    public long increment(String key, double windowSeconds, OptionalDouble maxTtlSeconds) {
        if (!store.isInitialized()) {
            metrics.recordIncrement(CounterOutcome.EXIT_EARLY);
            return 0;
        }
        if (!isCountable(key, windowSeconds)) {
            LOG.warnv("Rejected increment for invalid counter: key={0}, windowSeconds={1}", key, windowSeconds);
            metrics.recordIncrement(CounterOutcome.ERROR);
            return 0;
        }

        final var counter = new CounterKey(key, windowSeconds);
        final var nowSeconds = nowEpochSeconds();
        final var bucketSize = BucketKeyScheme.bucketSize(windowSeconds);
        final var bucketKey = BucketKeyScheme.bucketKey(counter, BucketKeyScheme.bucketId(nowSeconds, bucketSize));
        final var ttl = BucketKeyScheme.bucketTtl(windowSeconds, bucketSize, maxTtlSeconds);

        if (!recordOccurrence(bucketKey, ttl)) {
            metrics.recordIncrement(CounterOutcome.ERROR);
            return 0;
        }

        final var total = readWindow(counter, nowSeconds);
        metrics.recordIncrement(CounterOutcome.OK);
        return total.count();
    }

    @Override
    public long query(String key, double windowSeconds) {
        if (!store.isInitialized()) {
            metrics.recordQuery(CounterOutcome.EXIT_EARLY);
            return 0;
        }
        if (!isCountable(key, windowSeconds)) {
            LOG.warnv("Rejected query for invalid counter: key={0}, windowSeconds={1}", key, windowSeconds);
            metrics.recordQuery(CounterOutcome.ERROR);
            return 0;
        }

        final var total = readWindow(new CounterKey(key, windowSeconds), nowEpochSeconds());
        metrics.recordQuery(total.outcome());
        return total.count();
    }

    private boolean recordOccurrence(String bucketKey, Duration ttl) {
        try {
            final var count = store.increment(bucketKey);
            if (count.isPresent()) {
                if (count.getAsLong() == FIRST_OCCURRENCE) {
                    assignTtl(bucketKey, count.getAsLong(), ttl);
                }
                return true;
            }
            LOG.debugv("Bucket {0} does not exist yet, creating it", bucketKey);
        } catch (CounterStoreException e) {
            if (policy.actionFor(StoreOperation.INCREMENT, e.kind()) != FailureAction.RETRY_ONCE) {
                LOG.errorv("Counter increment failed for {0}: {1}", bucketKey, e.getMessage());
                return false;
            }
            LOG.debugv("Increment of {0} failed, falling back to add-if-absent: {1}", bucketKey, e.getMessage());
        }
        return createOrRetry(bucketKey, ttl);
    }

    private boolean createOrRetry(String bucketKey, Duration ttl) {
        try {
            if (store.addIfAbsent(bucketKey, FIRST_OCCURRENCE, ttl)) {
                return true;
            }
            // Lost the creation race; the bucket exists now
            if (store.increment(bucketKey).isPresent()) {
                return true;
            }
            LOG.errorv("Counter increment failed for {0}: bucket missing after add-if-absent", bucketKey);
            return false;
        } catch (CounterStoreException e) {
            LOG.errorv("Counter increment failed for {0}: {1}", bucketKey, e.getMessage());
            return false;
        }
    }

    private void assignTtl(String bucketKey, long count, Duration ttl) {
        try {
            final var result = store.touch(bucketKey, ttl);
            if (result == TouchResult.TOUCHED) {
                return;
            }
            if (result == TouchResult.NOT_FOUND) {
                LOG.debugv("Bucket {0} expired before its TTL was set", bucketKey);
                return;
            }
        } catch (CounterStoreException e) {
            if (policy.actionFor(StoreOperation.TTL_REFRESH, e.kind()) != FailureAction.DEGRADE) {
                LOG.warnv("TTL refresh failed for {0}: {1}", bucketKey, e.getMessage());
                metrics.recordTtlRefreshFailure();
                return;
            }
            LOG.debugv("TTL refresh failed for {0}, overwriting instead: {1}", bucketKey, e.getMessage());
        }

        // Races with concurrent increments of the same bucket; see class docs
        try {
            store.set(bucketKey, Long.toString(count), ttl);
        } catch (CounterStoreException e) {
            LOG.warnv("TTL assignment by overwrite failed for {0}: {1}", bucketKey, e.getMessage());
            metrics.recordTtlRefreshFailure();
        }
    }

    private WindowTotal readWindow(CounterKey counter, double nowSeconds) {
        final var range = BucketKeyScheme.bucketRange(nowSeconds, counter.windowSeconds());
        final var keys = range.bucketIds()
                .mapToObj(bucketId -> BucketKeyScheme.bucketKey(counter, bucketId))
                .toList();
        metrics.recordBucketReads(keys.size());

        final Map<String, String> values;
        try {
            values = store.getMulti(keys);
        } catch (CounterStoreException e) {
            if (policy.actionFor(StoreOperation.WINDOW_READ, e.kind()) != FailureAction.DEGRADE) {
                LOG.errorv("Window read failed for {0}: {1}", counter.logicalKey(), e.getMessage());
                return WindowTotal.failed();
            }
            LOG.warnv(
                    "Batched read failed for {0}, reading {1} buckets individually: {2}",
                    counter.logicalKey(), keys.size(), e.getMessage());
            return sumIndividually(keys);
        }

        var total = 0L;
        for (final var key : keys) {
            final var value = values.get(key);
            if (value == null) {
                continue;
            }
            final var decoded = decode(key, value);
            if (decoded.isPresent()) {
                total += decoded.getAsLong();
            } else if (!skipsBucket(StoreErrorKind.DECODE)) {
                return WindowTotal.failed();
            }
        }
        return new WindowTotal(total, CounterOutcome.OK);
    }

    private WindowTotal sumIndividually(List<String> keys) {
        var total = 0L;
        for (final var key : keys) {
            try {
                final var value = store.get(key);
                if (value.isEmpty()) {
                    continue;
                }
                final var decoded = decode(key, value.get());
                if (decoded.isPresent()) {
                    total += decoded.getAsLong();
                } else if (!skipsBucket(StoreErrorKind.DECODE)) {
                    return WindowTotal.failed();
                }
            } catch (CounterStoreException e) {
                if (!skipsBucket(e.kind())) {
                    LOG.errorv("Bucket read failed for {0}, abandoning window: {1}", key, e.getMessage());
                    return WindowTotal.failed();
                }
                LOG.debugv("Skipping unreadable bucket {0}: {1}", key, e.getMessage());
            }
        }
        return new WindowTotal(total, CounterOutcome.DEGRADED);
    }

    private OptionalLong decode(String bucketKey, String value) {
        try {
            return OptionalLong.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            LOG.debugv("Skipping bucket {0} with undecodable value", bucketKey);
            metrics.recordDecodeSkip();
            return OptionalLong.empty();
        }
    }

    private boolean skipsBucket(StoreErrorKind kind) {
        return policy.actionFor(StoreOperation.BUCKET_READ, kind) == FailureAction.SKIP;
    }

    private static boolean isCountable(String key, double windowSeconds) {
        return CounterKey.isValid(key, windowSeconds) && BucketKeyScheme.withinBucketLimit(windowSeconds);
    }

    private double nowEpochSeconds() {
        return clock.millis() / 1000.0;
    }

    private record WindowTotal(long count, CounterOutcome outcome) {

        static WindowTotal failed() {
            return new WindowTotal(0, CounterOutcome.ERROR);
        }
    }
}
