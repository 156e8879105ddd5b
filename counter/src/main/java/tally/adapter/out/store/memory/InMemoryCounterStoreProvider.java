package tally.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;

import tally.core.port.out.AtomicCounterStore;
import tally.spi.CounterStoreProvider;

/**
 * In-memory counter store provider.
 *
 * <p>Always available, with the lowest priority (0), so Redis is preferred
 * whenever it is configured.
 */
public final class InMemoryCounterStoreProvider implements CounterStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Clock clock;
    private final Duration cleanupInterval;

    public InMemoryCounterStoreProvider(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
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
        // In-memory is always available as fallback
        return true;
    }

    @Override
    public AtomicCounterStore createStore() {
        return new InMemoryAtomicCounterStore(clock, cleanupInterval);
    }
}
