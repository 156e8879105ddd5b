package tally.core.port.out;

import tally.core.model.counter.CounterOutcome;

/**
 * Port interface for recording counter metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface CounterMetrics {

    /**
     * Record the outcome of a window increment.
     *
     * @param outcome the outcome
     */
    void recordIncrement(CounterOutcome outcome);

    /**
     * Record the outcome of a read-only window query.
     *
     * @param outcome the outcome
     */
    void recordQuery(CounterOutcome outcome);

    /**
     * Record the number of bucket keys requested from the store for one window read.
     *
     * @param bucketCount the number of keys read
     */
    void recordBucketReads(int bucketCount);

    /**
     * Record a bucket whose stored value could not be decoded and was skipped.
     */
    void recordDecodeSkip();

    /**
     * Record a freshly created bucket whose TTL could not be set.
     */
    void recordTtlRefreshFailure();

    /**
     * Record a typed value operation.
     *
     * @param operation the operation (e.g., "get_int", "set")
     * @param outcome the outcome
     */
    void recordValueOperation(String operation, CounterOutcome outcome);

    /**
     * Record a store operation that exceeded its timeout.
     *
     * @param store the store name
     * @param operation the operation name
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a store operation that failed for a reason other than a timeout.
     *
     * @param store the store name
     * @param operation the operation name
     */
    void recordStoreFailure(String store, String operation);
}
