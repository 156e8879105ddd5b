package tally.spi;

import tally.core.port.out.AtomicCounterStore;

/**
 * Service Provider Interface for counter store implementations.
 *
 * <p>Providers are selected by the store loader, either by name
 * ({@code tally.counter.store.provider}) or, with {@code auto}, by priority.
 * Higher priority providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Single-instance only, for development and tests</li>
 *   <li>Redis (priority 10) - Distributed, recommended for production</li>
 * </ul>
 *
 * @see tally.core.port.out.AtomicCounterStore
 */
public interface CounterStoreProvider {

    /**
     * Return the priority of this provider.
     *
     * <p>Standard priorities:
     * <ul>
     *   <li>0 - In-memory (fallback)</li>
     *   <li>10 - Redis (production default)</li>
     *   <li>100+ - Custom implementations</li>
     * </ul>
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * <p>Providers check for required dependencies and configuration, not for
     * server reachability; an unreachable store is handled by failing open.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create an uninitialized counter store.
     *
     * <p>Called once during application startup. The returned instance must be
     * thread-safe.
     *
     * @return the counter store
     */
    AtomicCounterStore createStore();
}
