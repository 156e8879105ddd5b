package tally.core.model.store;

import java.time.Duration;

/**
 * A store operation exceeded the per-call timeout.
 */
public class StoreTimeoutException extends CounterStoreException {

    private final String store;

    public StoreTimeoutException(String store, String operation, Duration timeout) {
        super(
                StoreErrorKind.TRANSIENT,
                operation,
                "Store operation timeout: " + operation + " in " + store + " after " + timeout);
        this.store = store;
    }

    /** Returns the store where the timeout occurred. */
    public String store() {
        return store;
    }
}
