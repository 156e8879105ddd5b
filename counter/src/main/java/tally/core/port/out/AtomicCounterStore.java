package tally.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreEndpoint;
import tally.core.model.store.TouchResult;

/**
 * Port interface for the distributed key-value store holding counter buckets.
 *
 * <p>This is a narrow capability interface: atomic increment, add-if-absent,
 * best-effort TTL refresh and batched reads, plus the plain get/set that the
 * degraded read path and typed values need. Implementations exist per store
 * client (Redis, in-memory).
 *
 * <p>Every operation is synchronous and bounded by a per-call timeout. Any
 * failure, including a timeout, surfaces as {@link CounterStoreException}; an
 * implementation never lets a client-specific exception escape. Operations on a
 * store that is not initialized fail with
 * {@link tally.core.model.store.StoreErrorKind#UNINITIALIZED}.
 *
 * <p>Values are stored as strings; counters hold decimal integers.
 */
public interface AtomicCounterStore extends AutoCloseable {

    /**
     * Connect to the given servers.
     *
     * <p>If the servers cannot be reached, the store stays uninitialized for the
     * rest of its lifetime and every operation fails open. Calling this method on
     * an initialized store has no effect.
     *
     * @param endpoints the servers to use
     */
    void initialize(List<StoreEndpoint> endpoints);

    /**
     * Check if {@link #initialize} succeeded and the store has not been closed.
     *
     * @return true if operations may be attempted
     */
    boolean isInitialized();

    /**
     * Atomically increment a counter.
     *
     * <p>Whether a missing key is created is store-dependent: Redis creates it at 1,
     * memcached-compatible stores report it as missing.
     *
     * @param key the counter key
     * @return the post-increment value, or empty if the key does not exist and was not created
     * @throws CounterStoreException on failure
     */
    OptionalLong increment(String key);

    /**
     * Create a key only if it does not exist.
     *
     * @param key the key
     * @param initialValue the value to store
     * @param ttl the expiry of the new key
     * @return true if this call created the key, false if it already existed
     * @throws CounterStoreException on failure
     */
    boolean addIfAbsent(String key, long initialValue, Duration ttl);

    /**
     * Refresh a key's TTL without altering its value.
     *
     * @param key the key
     * @param ttl the new expiry
     * @return whether the TTL was applied, the key was missing, or the store cannot do this
     * @throws CounterStoreException on failure
     */
    TouchResult touch(String key, Duration ttl);

    /**
     * Read a single value.
     *
     * @param key the key
     * @return the stored value, or empty if absent
     * @throws CounterStoreException on failure
     */
    Optional<String> get(String key);

    /**
     * Read many values in one round trip.
     *
     * <p>Keys without a stored value are absent from the result, never zero-filled.
     * A store may also report keys on an unreachable shard as absent instead of
     * failing the whole call.
     *
     * @param keys the keys to read
     * @return the values that were found
     * @throws CounterStoreException if the batch failed as a whole
     */
    Map<String, String> getMulti(Collection<String> keys);

    /**
     * Store a value unconditionally.
     *
     * @param key the key
     * @param value the value
     * @param ttl the expiry; {@link Duration#ZERO} stores without expiry
     * @throws CounterStoreException on failure
     */
    void set(String key, String value, Duration ttl);

    /**
     * Name of the backing store, for logs, metrics and health data.
     *
     * @return the store name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Release client resources. The store is uninitialized afterwards.
     */
    @Override
    void close();
}
