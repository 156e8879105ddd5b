package tally.core.model.store;

import java.util.Objects;

/**
 * Failure of a single store operation.
 *
 * <p>Store adapters translate every client-level failure into this exception so
 * that services can branch on {@link #kind()} instead of on client types.
 */
public class CounterStoreException extends RuntimeException {

    private final StoreErrorKind kind;
    private final String operation;

    public CounterStoreException(StoreErrorKind kind, String operation, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.operation = operation;
    }

    public CounterStoreException(StoreErrorKind kind, String operation, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.operation = operation;
    }

    /**
     * Create the exception raised by any operation on a store that was never initialized.
     *
     * @param operation the attempted operation
     * @return the exception
     */
    public static CounterStoreException uninitialized(String operation) {
        return new CounterStoreException(
                StoreErrorKind.UNINITIALIZED, operation, "Counter store not initialized: " + operation);
    }

    public StoreErrorKind kind() {
        return kind;
    }

    /** Returns the name of the store operation that failed. */
    public String operation() {
        return operation;
    }
}
