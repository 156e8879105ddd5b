package tally.core.model.counter;

/**
 * Outcome of a counter or value operation, used as the {@code status} metric tag.
 */
public enum CounterOutcome {
    /** The store answered every call the operation needed. */
    OK("ok"),

    /** The answer was assembled from a fallback path, e.g. per-key reads after a failed multi-get. */
    DEGRADED("degraded"),

    /** The store failed and the caller received the default value. */
    ERROR("error"),

    /** The store was never initialized; nothing was attempted. */
    EXIT_EARLY("exit_early");

    private final String label;

    CounterOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
