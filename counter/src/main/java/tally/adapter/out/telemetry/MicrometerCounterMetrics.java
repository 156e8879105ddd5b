package tally.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tally.core.model.counter.CounterOutcome;
import tally.core.port.out.CounterMetrics;

/**
 * Records counter and store metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tally.counter.increments} - Window increments by status (ok, error, exit_early)</li>
 *   <li>{@code tally.counter.queries} - Window queries by status (ok, degraded, error, exit_early)</li>
 *   <li>{@code tally.counter.bucket.reads} - Bucket keys requested from the store</li>
 *   <li>{@code tally.counter.decode.skipped} - Buckets skipped because their value did not decode</li>
 *   <li>{@code tally.counter.ttl.refresh.failures} - New buckets left without a TTL</li>
 *   <li>{@code tally.values.operations} - Typed value gets and sets by operation and status</li>
 *   <li>{@code tally.store.timeouts} - Store operations that exceeded the timeout</li>
 *   <li>{@code tally.store.failures} - Store operations that failed otherwise</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCounterMetrics implements CounterMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerCounterMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    // -------------------------------------------------------------------------
    // Counter Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordIncrement(CounterOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counter.increments")
                .description("Number of increments to window counters")
                .tag("status", outcome.label())
                .register(registry)
                .increment();
    }

    @Override
    public void recordQuery(CounterOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counter.queries")
                .description("Number of read-only window queries")
                .tag("status", outcome.label())
                .register(registry)
                .increment();
    }

    /**
     * Record bucket reads. Counts keys, not round trips, so a 300-bucket multi-get adds 300.
     */
    @Override
    public void recordBucketReads(int bucketCount) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counter.bucket.reads")
                .description("Number of bucket keys read from the store")
                .register(registry)
                .increment(bucketCount);
    }

    @Override
    public void recordDecodeSkip() {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counter.decode.skipped")
                .description("Buckets skipped because the stored value was not an integer")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTtlRefreshFailure() {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.counter.ttl.refresh.failures")
                .description("Newly created buckets whose TTL could not be set")
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Value Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordValueOperation(String operation, CounterOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.values.operations")
                .description("Typed value operations")
                .tag("operation", nullSafe(operation))
                .tag("status", outcome.label())
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Store Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.store.timeouts")
                .description("Store operations that exceeded the operation timeout")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tally.store.failures")
                .description("Store operations that failed for reasons other than timeout")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
