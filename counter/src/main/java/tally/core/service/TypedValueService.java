package tally.core.service;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tally.core.model.counter.CounterOutcome;
import tally.core.model.store.CounterStoreException;
import tally.core.port.in.CacheValueAccess;
import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;

/**
 * Typed get-with-default and set over the counter store.
 *
 * <p>Shares the counter's store and its fail-open behavior: an uninitialized
 * store, a store failure or a value of the wrong type all produce the caller's
 * default, and writes to an unavailable store are dropped.
 */
@ApplicationScoped
public class TypedValueService implements CacheValueAccess {

    private static final Logger LOG = Logger.getLogger(TypedValueService.class);

    private final AtomicCounterStore store;
    private final CounterMetrics metrics;

    @Inject
    public TypedValueService(AtomicCounterStore store, CounterMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public String getString(String key, String defaultValue) {
        return read("get_str", key, defaultValue, Function.identity());
    }

    @Override
    public long getLong(String key, long defaultValue) {
        return read("get_int", key, defaultValue, value -> Long.parseLong(value.trim()));
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        return read("get_float", key, defaultValue, value -> Double.parseDouble(value.trim()));
    }

    @Override
    public void set(String key, String value, double ttlSeconds) {
        write(key, value, ttlSeconds);
    }

    @Override
    public void set(String key, long value, double ttlSeconds) {
        write(key, Long.toString(value), ttlSeconds);
    }

    @Override
    public void set(String key, double value, double ttlSeconds) {
        write(key, Double.toString(value), ttlSeconds);
    }

    private <T> T read(String operation, String key, T defaultValue, Function<String, T> parser) {
        if (!store.isInitialized()) {
            metrics.recordValueOperation(operation, CounterOutcome.EXIT_EARLY);
            return defaultValue;
        }
        if (key == null || key.isBlank()) {
            metrics.recordValueOperation(operation, CounterOutcome.ERROR);
            return defaultValue;
        }

        final Optional<String> stored;
        try {
            stored = store.get(key);
        } catch (CounterStoreException e) {
            LOG.errorv("Error getting value for {0}: {1}", key, e.getMessage());
            metrics.recordValueOperation(operation, CounterOutcome.ERROR);
            return defaultValue;
        }

        if (stored.isEmpty()) {
            metrics.recordValueOperation(operation, CounterOutcome.OK);
            return defaultValue;
        }

        try {
            final var parsed = parser.apply(stored.get());
            metrics.recordValueOperation(operation, CounterOutcome.OK);
            return parsed;
        } catch (NumberFormatException e) {
            LOG.warnv("Stored value for {0} is not valid for {1}", key, operation);
            metrics.recordValueOperation(operation, CounterOutcome.ERROR);
            return defaultValue;
        }
    }

    private void write(String key, String value, double ttlSeconds) {
        if (!store.isInitialized()) {
            metrics.recordValueOperation("set", CounterOutcome.EXIT_EARLY);
            return;
        }
        if (key == null || key.isBlank() || value == null) {
            LOG.warnv("Dropped write with missing key or value: key={0}", key);
            metrics.recordValueOperation("set", CounterOutcome.ERROR);
            return;
        }

        try {
            store.set(key, value, toTtl(ttlSeconds));
            metrics.recordValueOperation("set", CounterOutcome.OK);
        } catch (CounterStoreException e) {
            LOG.errorv("Error setting value for {0}: {1}", key, e.getMessage());
            metrics.recordValueOperation("set", CounterOutcome.ERROR);
        }
    }

    private static Duration toTtl(double ttlSeconds) {
        if (!(ttlSeconds > 0) || Double.isInfinite(ttlSeconds)) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) Math.ceil(ttlSeconds * 1000));
    }
}
