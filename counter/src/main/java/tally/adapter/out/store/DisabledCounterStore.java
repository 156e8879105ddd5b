package tally.adapter.out.store;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreEndpoint;
import tally.core.model.store.TouchResult;
import tally.core.port.out.AtomicCounterStore;

/**
 * A store that is never initialized.
 *
 * <p>Used when counting is disabled or when the configured provider cannot be
 * used. Every counter call exits early and answers its default.
 */
public final class DisabledCounterStore implements AtomicCounterStore {

    private static final DisabledCounterStore INSTANCE = new DisabledCounterStore();

    private DisabledCounterStore() {}

    /**
     * Return the singleton instance.
     *
     * @return the disabled store
     */
    public static DisabledCounterStore getInstance() {
        return INSTANCE;
    }

    @Override
    public void initialize(List<StoreEndpoint> endpoints) {}

    @Override
    public boolean isInitialized() {
        return false;
    }

    @Override
    public OptionalLong increment(String key) {
        throw CounterStoreException.uninitialized("incr");
    }

    @Override
    public boolean addIfAbsent(String key, long initialValue, Duration ttl) {
        throw CounterStoreException.uninitialized("add");
    }

    @Override
    public TouchResult touch(String key, Duration ttl) {
        throw CounterStoreException.uninitialized("touch");
    }

    @Override
    public Optional<String> get(String key) {
        throw CounterStoreException.uninitialized("get");
    }

    @Override
    public Map<String, String> getMulti(Collection<String> keys) {
        throw CounterStoreException.uninitialized("get_multi");
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        throw CounterStoreException.uninitialized("set");
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public void close() {}
}
