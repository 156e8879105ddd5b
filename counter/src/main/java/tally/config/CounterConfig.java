package tally.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.vertx.redis.client.RedisClientType;

/**
 * Configuration mapping for velocity counters and their store.
 *
 * <p>Configuration prefix: {@code tally.counter}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TALLY_COUNTER_ENABLED} - Enable/disable counting (disabled counters answer 0)</li>
 *   <li>{@code TALLY_COUNTER_STORE_PROVIDER} - Store backend: auto, redis, memory</li>
 *   <li>{@code TALLY_COUNTER_STORE_SERVERS} - Comma-separated {@code host:port} list</li>
 *   <li>{@code TALLY_COUNTER_STORE_OPERATION_TIMEOUT} - Per-call store timeout</li>
 * </ul>
 */
@ConfigMapping(prefix = "tally.counter")
public interface CounterConfig {

    /**
     * Enable or disable counting globally.
     *
     * @return true if counting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Store backend configuration.
     */
    StoreConfig store();

    /**
     * Counter store configuration.
     */
    interface StoreConfig {

        /**
         * Store provider name.
         *
         * <p>{@code auto} selects the highest-priority available provider. A named
         * provider that is unknown or unavailable leaves counters failing open; it
         * never falls back to a different backend.
         *
         * @return provider name (default: auto)
         */
        @WithDefault("auto")
        String provider();

        /**
         * Store servers as {@code host:port} entries. Invalid entries are logged and skipped.
         *
         * @return the server list, if configured
         */
        Optional<List<String>> servers();

        /**
         * Maximum time to wait for a single store operation.
         *
         * <p>On timeout the operation fails as a transient error and the counter
         * falls back per its failure policy.
         *
         * @return operation timeout (default: 500 milliseconds)
         */
        @WithDefault("PT0.5S")
        Duration operationTimeout();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        /**
         * In-memory store configuration.
         */
        MemoryConfig memory();
    }

    /**
     * Redis store configuration.
     */
    interface RedisConfig {

        /**
         * Redis client type.
         *
         * <p>{@code STANDALONE} talks to the first server only; {@code CLUSTER} treats the
         * servers as seed nodes of a sharded cluster.
         *
         * @return client type (default: STANDALONE)
         */
        @WithDefault("STANDALONE")
        RedisClientType clientType();

        /**
         * Maximum connections in the client pool.
         *
         * @return pool size (default: 30)
         */
        @WithDefault("30")
        int poolSize();
    }

    /**
     * In-memory store configuration.
     */
    interface MemoryConfig {

        /**
         * Interval between sweeps of expired entries.
         *
         * @return cleanup interval (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration cleanupInterval();
    }
}
