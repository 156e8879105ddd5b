package tally.adapter.out.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import tally.adapter.out.store.memory.InMemoryCounterStoreProvider;
import tally.adapter.out.store.redis.RedisCounterStoreProvider;
import tally.config.CounterConfig;
import tally.core.model.store.StoreEndpoint;
import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;
import tally.spi.CounterStoreProvider;

/**
 * CDI producer for the counter store.
 *
 * <p>Selects the store implementation from configuration:
 * <ul>
 *   <li>{@code auto} - the highest-priority available provider (Redis when servers
 *       are configured, otherwise in-memory)</li>
 *   <li>{@code redis} / {@code memory} - that provider only; if it cannot be used,
 *       counters fail open instead of silently counting somewhere else</li>
 * </ul>
 *
 * <p>The produced store is initialized with the parsed server list. When counting
 * is disabled, returns a store that is never initialized.
 */
@ApplicationScoped
public class CounterStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(CounterStoreProviderLoader.class);

    private static final String AUTO = "auto";

    private final CounterConfig config;
    private final CounterMetrics metrics;
    private final Clock clock;
    private final Instance<Vertx> vertx;

    @Inject
    public CounterStoreProviderLoader(
            CounterConfig config, CounterMetrics metrics, Clock clock, Instance<Vertx> vertx) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.vertx = vertx;
    }

    /**
     * Produces the counter store instance for CDI injection.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    public AtomicCounterStore produceCounterStore() {
        if (!config.enabled()) {
            LOG.info("Velocity counting is disabled, using DisabledCounterStore");
            return DisabledCounterStore.getInstance();
        }

        final var provider = selectProvider(config.store().provider());
        if (provider.isEmpty()) {
            return DisabledCounterStore.getInstance();
        }

        LOG.infov("Using counter store provider: {0}", provider.get().name());
        final var store = provider.get().createStore();
        store.initialize(parseEndpoints(config.store().servers().orElse(List.of())));
        if (!store.isInitialized()) {
            LOG.warnv("Counter store {0} failed to initialize, counters will fail open", store.name());
        }
        return store;
    }

    /**
     * Disposes the counter store, closing client connections and cleanup executors.
     */
    void disposeCounterStore(@Disposes AtomicCounterStore store) {
        store.close();
    }

    Optional<CounterStoreProvider> selectProvider(String name) {
        final var providers = providers();
        if (AUTO.equalsIgnoreCase(name)) {
            return providers.stream()
                    .filter(CounterStoreProvider::isAvailable)
                    .max(Comparator.comparingInt(CounterStoreProvider::priority));
        }

        final var named = providers.stream()
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst();
        if (named.isEmpty()) {
            LOG.errorv("Unknown counter store provider {0}, counters will fail open", name);
            return Optional.empty();
        }
        if (!named.get().isAvailable()) {
            LOG.errorv("Counter store provider {0} is not available, counters will fail open", name);
            return Optional.empty();
        }
        return named;
    }

    /**
     * Parse configured {@code host:port} entries, skipping invalid ones.
     *
     * @param servers the configured entries
     * @return the valid endpoints, in configuration order
     */
    static List<StoreEndpoint> parseEndpoints(List<String> servers) {
        final var endpoints = new ArrayList<StoreEndpoint>();
        for (final var server : servers) {
            final var endpoint = StoreEndpoint.parse(server);
            if (endpoint.isEmpty()) {
                LOG.errorv("Invalid store server entry \"{0}\", expected host:port; skipping", server);
                continue;
            }
            endpoints.add(endpoint.get());
        }
        return endpoints;
    }

    private List<CounterStoreProvider> providers() {
        final var store = config.store();
        final var serversConfigured =
                store.servers().map(servers -> !servers.isEmpty()).orElse(false);
        final var vertxInstance = vertx.isResolvable() ? vertx.get() : null;
        return List.of(
                new RedisCounterStoreProvider(
                        vertxInstance,
                        serversConfigured,
                        store.redis().clientType(),
                        store.redis().poolSize(),
                        store.operationTimeout(),
                        metrics),
                new InMemoryCounterStoreProvider(clock, store.memory().cleanupInterval()));
    }
}
