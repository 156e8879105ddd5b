package tally.core.model.store;

/**
 * Store interactions that have their own row in the failure policy table.
 */
public enum StoreOperation {
    /** Atomic increment of the current bucket. */
    INCREMENT,

    /** TTL assignment on a freshly created bucket. */
    TTL_REFRESH,

    /** Batched read of every bucket in a window. */
    WINDOW_READ,

    /** Single bucket, either decoded from a batch or fetched alone. */
    BUCKET_READ
}
