package tally.adapter.out.store.redis;

import java.time.Duration;

import io.vertx.mutiny.core.Vertx;
import io.vertx.redis.client.RedisClientType;

import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;
import tally.spi.CounterStoreProvider;

/**
 * Redis-based counter store provider for distributed deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected automatically when store servers are configured and a Vert.x
 * instance is available.
 */
public final class RedisCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final Vertx vertx;
    private final boolean serversConfigured;
    private final RedisClientType clientType;
    private final int poolSize;
    private final Duration operationTimeout;
    private final CounterMetrics metrics;

    /**
     * Creates a new Redis provider with configuration.
     *
     * @param vertx the Vert.x instance, or null if none is available
     * @param serversConfigured whether any store server is configured
     * @param clientType standalone or cluster client
     * @param poolSize maximum pooled connections
     * @param operationTimeout per-call timeout
     * @param metrics metrics for store timeouts and failures
     */
    public RedisCounterStoreProvider(
            Vertx vertx,
            boolean serversConfigured,
            RedisClientType clientType,
            int poolSize,
            Duration operationTimeout,
            CounterMetrics metrics) {
        this.vertx = vertx;
        this.serversConfigured = serversConfigured;
        this.clientType = clientType;
        this.poolSize = poolSize;
        this.operationTimeout = operationTimeout;
        this.metrics = metrics;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return serversConfigured && vertx != null;
    }

    @Override
    public AtomicCounterStore createStore() {
        if (vertx == null) {
            throw new IllegalStateException(
                    "Provider not configured. Use CounterStoreProviderLoader for proper initialization.");
        }
        return new RedisAtomicCounterStore(vertx, clientType, poolSize, operationTimeout, metrics);
    }
}
