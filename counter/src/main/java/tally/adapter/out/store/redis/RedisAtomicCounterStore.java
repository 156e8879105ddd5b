package tally.adapter.out.store.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import io.vertx.redis.client.RedisClientType;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreEndpoint;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.TouchResult;
import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;

/**
 * Redis-backed counter store for distributed deployments.
 *
 * <p>Command mapping:
 * <ul>
 *   <li>increment: {@code INCR} (creates missing keys at 1, without expiry)</li>
 *   <li>add-if-absent: {@code SET key value NX PX ttl}</li>
 *   <li>touch: {@code PEXPIRE}</li>
 *   <li>get / multi-get: {@code GET} / {@code MGET}</li>
 *   <li>set: {@code SET key value [PX ttl]}</li>
 * </ul>
 *
 * <p>With {@link RedisClientType#CLUSTER} the configured servers are seed nodes and
 * the client routes each key to its shard; multi-key reads are split per slot by
 * the client.
 *
 * <p>If the servers do not answer {@code PING} during {@link #initialize}, the store
 * stays uninitialized for its lifetime and every operation fails open.
 */
public final class RedisAtomicCounterStore implements AtomicCounterStore {

    private static final Logger LOG = Logger.getLogger(RedisAtomicCounterStore.class);

    private static final String NAME = "redis";

    private final Vertx vertx;
    private final RedisClientType clientType;
    private final int poolSize;
    private final RedisTimeoutHelper timeouts;

    private volatile Redis client;
    private volatile RedisAPI api;

    public RedisAtomicCounterStore(
            Vertx vertx, RedisClientType clientType, int poolSize, Duration operationTimeout, CounterMetrics metrics) {
        this.vertx = vertx;
        this.clientType = clientType;
        this.poolSize = poolSize;
        this.timeouts = new RedisTimeoutHelper(operationTimeout, metrics, NAME);
    }

    @Override
    public synchronized void initialize(List<StoreEndpoint> endpoints) {
        if (api != null) {
            LOG.warn("Redis counter store already initialized, ignoring");
            return;
        }
        if (endpoints.isEmpty()) {
            LOG.error("No valid Redis servers configured, counters will fail open");
            return;
        }

        final var options = new RedisOptions().setType(clientType).setMaxPoolSize(poolSize);
        endpoints.forEach(endpoint -> options.addConnectionString("redis://" + endpoint));

        final Redis candidate;
        try {
            candidate = Redis.createClient(vertx, options);
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to create Redis client for {0}, counters will fail open", endpoints);
            return;
        }
        final var candidateApi = RedisAPI.api(candidate);
        try {
            timeouts.await(candidateApi.ping(List.of()), "ping");
        } catch (CounterStoreException e) {
            LOG.errorv("Redis servers {0} unreachable, counters will fail open: {1}", endpoints, e.getMessage());
            candidate.close();
            return;
        }

        client = candidate;
        api = candidateApi;
        LOG.infov("Initialized Redis counter store: servers={0}, type={1}", endpoints, clientType);
    }

    @Override
    public boolean isInitialized() {
        return api != null;
    }

    @Override
    public OptionalLong increment(String key) {
        final var response = timeouts.await(api("incr").incr(key), "incr");
        if (response == null) {
            throw nullResponse("incr");
        }
        return OptionalLong.of(response.toLong());
    }

    @Override
    public boolean addIfAbsent(String key, long initialValue, Duration ttl) {
        final var args = new ArrayList<String>(5);
        args.add(key);
        args.add(Long.toString(initialValue));
        args.add("NX");
        addExpiry(args, ttl);
        // Nil reply when the key already exists
        return timeouts.await(api("set_nx").set(args), "set_nx") != null;
    }

    @Override
    public TouchResult touch(String key, Duration ttl) {
        final var response =
                timeouts.await(api("pexpire").pexpire(List.of(key, Long.toString(toMillis(ttl)))), "pexpire");
        if (response == null) {
            throw nullResponse("pexpire");
        }
        return response.toLong() == 1 ? TouchResult.TOUCHED : TouchResult.NOT_FOUND;
    }

    @Override
    public Optional<String> get(String key) {
        final var response = timeouts.await(api("get").get(key), "get");
        return Optional.ofNullable(response).map(Response::toString);
    }

    @Override
    public Map<String, String> getMulti(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }

        final var ordered = List.copyOf(keys);
        final var response = timeouts.await(api("mget").mget(ordered), "mget");
        if (response == null) {
            throw nullResponse("mget");
        }

        final var values = new HashMap<String, String>();
        for (var i = 0; i < ordered.size() && i < response.size(); i++) {
            final var value = response.get(i);
            if (value != null) {
                values.put(ordered.get(i), value.toString());
            }
        }
        return values;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        final var args = new ArrayList<String>(4);
        args.add(key);
        args.add(value);
        if (!ttl.isZero() && !ttl.isNegative()) {
            addExpiry(args, ttl);
        }
        timeouts.await(api("set").set(args), "set");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void close() {
        final var current = client;
        api = null;
        client = null;
        if (current != null) {
            current.close();
            LOG.info("Closed Redis counter store");
        }
    }

    private RedisAPI api(String operation) {
        final var current = api;
        if (current == null) {
            throw CounterStoreException.uninitialized(operation);
        }
        return current;
    }

    private static void addExpiry(List<String> args, Duration ttl) {
        args.add("PX");
        args.add(Long.toString(toMillis(ttl)));
    }

    private static long toMillis(Duration ttl) {
        return Math.max(1, ttl.toMillis());
    }

    private static CounterStoreException nullResponse(String operation) {
        return new CounterStoreException(StoreErrorKind.TRANSIENT, operation, "Null response from Redis: " + operation);
    }
}
