package tally.core.model.store;

/**
 * Kinds of store failure a counter operation can run into.
 *
 * <p>Each kind is resolved by {@code StoreFailurePolicy} into a concrete action;
 * none of them reaches the caller as an exception.
 */
public enum StoreErrorKind {
    /** The store was never initialized, or initialization failed. */
    UNINITIALIZED,

    /** Network error, timeout or server error on a single operation. */
    TRANSIENT,

    /** A stored value could not be decoded as the expected type. */
    DECODE
}
