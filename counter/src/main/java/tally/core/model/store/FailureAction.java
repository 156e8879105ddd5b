package tally.core.model.store;

/**
 * What a counter operation does after a store failure.
 */
public enum FailureAction {
    /** Stop and hand the caller its default value (0, the supplied default, or a no-op). */
    RETURN_DEFAULT,

    /** Fall back to add-if-absent and retry the increment once. */
    RETRY_ONCE,

    /** Continue on a slower path: per-key reads, or an overwrite instead of a touch. */
    DEGRADE,

    /** Drop the affected entry and carry on with the rest. */
    SKIP
}
