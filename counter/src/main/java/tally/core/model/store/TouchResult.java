package tally.core.model.store;

/**
 * Result of a best-effort TTL refresh.
 */
public enum TouchResult {
    TOUCHED,

    /** The key expired or was never written. */
    NOT_FOUND,

    /** The store cannot refresh a TTL without rewriting the value. */
    UNSUPPORTED
}
