package tally.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreEndpoint;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.TouchResult;
import tally.core.port.out.AtomicCounterStore;

/**
 * In-memory counter store with memcached semantics.
 *
 * <p>Suitable for development, testing, and single-instance deployments.
 * Counts are not shared between instances and are lost on restart.
 *
 * <p>Behaves like a memcached server: {@link #increment} never creates a key
 * and keeps the key's expiry, {@link #addIfAbsent} is the only way a counter
 * comes into existence, and incrementing a non-numeric value is a decode error.
 * Expired entries read as absent and are swept by a background task.
 */
public final class InMemoryAtomicCounterStore implements AtomicCounterStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAtomicCounterStore.class);

    private static final String NAME = "memory";
    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration cleanupInterval;

    private volatile ScheduledExecutorService cleanupExecutor;
    private volatile boolean initialized;

    /**
     * Create a new in-memory store.
     *
     * @param clock clock used for expiry
     * @param cleanupInterval interval between sweeps of expired entries; zero disables the sweep
     */
    public InMemoryAtomicCounterStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
    }

    @Override
    public synchronized void initialize(List<StoreEndpoint> endpoints) {
        if (initialized) {
            LOG.warn("In-memory counter store already initialized, ignoring");
            return;
        }
        if (!endpoints.isEmpty()) {
            LOG.debugv("In-memory counter store ignores configured servers {0}", endpoints);
        }

        if (!cleanupInterval.isZero() && !cleanupInterval.isNegative()) {
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                final var t = new Thread(r, "counter-store-cleanup");
                t.setDaemon(true);
                return t;
            });
            final var millis = cleanupInterval.toMillis();
            cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, millis, millis, TimeUnit.MILLISECONDS);
        }
        initialized = true;
        LOG.info("Initialized in-memory counter store");
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public OptionalLong increment(String key) {
        requireInitialized("incr");
        final var now = clock.millis();
        final var result = new Long[1];
        try {
            entries.computeIfPresent(key, (k, entry) -> {
                if (entry.isExpired(now)) {
                    return null;
                }
                final var next = Long.parseLong(entry.value()) + 1;
                result[0] = next;
                return new Entry(Long.toString(next), entry.expiresAtMillis());
            });
        } catch (NumberFormatException e) {
            throw new CounterStoreException(
                    StoreErrorKind.DECODE, "incr", "Cannot increment non-numeric value at " + key, e);
        }
        return result[0] == null ? OptionalLong.empty() : OptionalLong.of(result[0]);
    }

    @Override
    public boolean addIfAbsent(String key, long initialValue, Duration ttl) {
        requireInitialized("add");
        final var now = clock.millis();
        final var created = new boolean[1];
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created[0] = true;
            return new Entry(Long.toString(initialValue), expiresAt(now, ttl));
        });
        return created[0];
    }

    @Override
    public TouchResult touch(String key, Duration ttl) {
        requireInitialized("touch");
        final var now = clock.millis();
        final var touched = new boolean[1];
        entries.computeIfPresent(key, (k, entry) -> {
            if (entry.isExpired(now)) {
                return null;
            }
            touched[0] = true;
            return new Entry(entry.value(), expiresAt(now, ttl));
        });
        return touched[0] ? TouchResult.TOUCHED : TouchResult.NOT_FOUND;
    }

    @Override
    public Optional<String> get(String key) {
        requireInitialized("get");
        return Optional.ofNullable(liveValue(key, clock.millis()));
    }

    @Override
    public Map<String, String> getMulti(Collection<String> keys) {
        requireInitialized("get_multi");
        final var now = clock.millis();
        final var values = new HashMap<String, String>();
        for (final var key : keys) {
            final var value = liveValue(key, now);
            if (value != null) {
                values.put(key, value);
            }
        }
        return values;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requireInitialized("set");
        entries.put(key, new Entry(value, expiresAt(clock.millis(), ttl)));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void close() {
        initialized = false;
        final var executor = cleanupExecutor;
        cleanupExecutor = null;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        entries.clear();
    }

    /**
     * Number of entries currently held, including expired ones not yet swept.
     *
     * @return the entry count
     */
    public int entryCount() {
        return entries.size();
    }

    /**
     * Remove all expired entries.
     */
    void cleanupExpired() {
        final var now = clock.millis();
        final var before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugv("Removed {0} expired counter entries", removed);
        }
    }

    private String liveValue(String key, long now) {
        final var entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    private void requireInitialized(String operation) {
        if (!initialized) {
            throw CounterStoreException.uninitialized(operation);
        }
    }

    private static long expiresAt(long now, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return NO_EXPIRY;
        }
        return now + ttl.toMillis();
    }

    private record Entry(String value, long expiresAtMillis) {

        boolean isExpired(long now) {
            return now >= expiresAtMillis;
        }
    }
}
