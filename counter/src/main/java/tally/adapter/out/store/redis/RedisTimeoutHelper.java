package tally.adapter.out.store.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.StoreTimeoutException;
import tally.core.port.out.CounterMetrics;

/**
 * Applies the per-call timeout to Redis operations and translates their failures.
 *
 * <p>Every Redis call made by the counter store goes through {@link #await}, which
 * blocks the calling thread for at most the configured timeout. A timeout becomes a
 * {@link StoreTimeoutException}; any other client failure (connection refused,
 * server error, cluster redirection error) becomes a transient
 * {@link CounterStoreException}. Callers never see a Vert.x or Redis exception type.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code tally.store.timeouts}) and
 * non-timeout failures ({@code tally.store.failures}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final CounterMetrics metrics;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param storeName the store name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, CounterMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Wait for an operation, failing if it does not complete within the timeout.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return the operation result (may be null for Redis nil replies)
     * @throws StoreTimeoutException if the operation times out
     * @throws CounterStoreException if the operation fails
     */
    public <T> T await(Uni<T> operation, String operationName) {
        try {
            return operation
                    .ifNoItem()
                    .after(timeout)
                    .failWith(() -> new StoreTimeoutException(storeName, operationName, timeout))
                    .await()
                    .indefinitely();
        } catch (StoreTimeoutException e) {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
            recordTimeout(operationName);
            throw e;
        } catch (RuntimeException e) {
            LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, storeName, e.getMessage());
            recordFailure(operationName);
            throw new CounterStoreException(
                    StoreErrorKind.TRANSIENT, operationName, "Redis operation failed: " + operationName, e);
        }
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
