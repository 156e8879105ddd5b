package tally.core.service;

import java.util.EnumMap;
import java.util.Map;

import tally.core.model.store.FailureAction;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.StoreOperation;

/**
 * Policy table mapping a failed store operation and its error kind to an action.
 *
 * <p>Combinations missing from the table resolve to {@link FailureAction#RETURN_DEFAULT}.
 */
public final class StoreFailurePolicy {

    private static final StoreFailurePolicy STANDARD = standardTable();

    private final Map<StoreOperation, Map<StoreErrorKind, FailureAction>> table;

    private StoreFailurePolicy(Map<StoreOperation, Map<StoreErrorKind, FailureAction>> table) {
        this.table = table;
    }

    /**
     * The policy used by the counter and typed values:
     * <ul>
     *   <li>increments fall back to add-if-absent and one retry</li>
     *   <li>TTL assignment degrades to an overwrite</li>
     *   <li>window reads degrade to per-key reads</li>
     *   <li>bucket reads skip the failed bucket</li>
     *   <li>everything else returns the default</li>
     * </ul>
     *
     * @return the standard policy
     */
    public static StoreFailurePolicy standard() {
        return STANDARD;
    }

    /**
     * Start an empty policy where every combination returns the default.
     *
     * @return a builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the action for a failure.
     *
     * @param operation the failed operation
     * @param kind the kind of failure
     * @return the action to take
     */
    public FailureAction actionFor(StoreOperation operation, StoreErrorKind kind) {
        final var row = table.get(operation);
        if (row == null) {
            return FailureAction.RETURN_DEFAULT;
        }
        return row.getOrDefault(kind, FailureAction.RETURN_DEFAULT);
    }

    private static StoreFailurePolicy standardTable() {
        return builder()
                .on(StoreOperation.INCREMENT, StoreErrorKind.TRANSIENT, FailureAction.RETRY_ONCE)
                .on(StoreOperation.INCREMENT, StoreErrorKind.DECODE, FailureAction.RETRY_ONCE)
                .on(StoreOperation.TTL_REFRESH, StoreErrorKind.TRANSIENT, FailureAction.DEGRADE)
                .on(StoreOperation.TTL_REFRESH, StoreErrorKind.DECODE, FailureAction.DEGRADE)
                .on(StoreOperation.WINDOW_READ, StoreErrorKind.TRANSIENT, FailureAction.DEGRADE)
                .on(StoreOperation.BUCKET_READ, StoreErrorKind.TRANSIENT, FailureAction.SKIP)
                .on(StoreOperation.BUCKET_READ, StoreErrorKind.DECODE, FailureAction.SKIP)
                .build();
    }

    /**
     * Builder for custom policy tables.
     */
    public static final class Builder {

        private final Map<StoreOperation, Map<StoreErrorKind, FailureAction>> table =
                new EnumMap<>(StoreOperation.class);

        private Builder() {}

        public Builder on(StoreOperation operation, StoreErrorKind kind, FailureAction action) {
            table.computeIfAbsent(operation, op -> new EnumMap<>(StoreErrorKind.class))
                    .put(kind, action);
            return this;
        }

        public StoreFailurePolicy build() {
            final var copy = new EnumMap<StoreOperation, Map<StoreErrorKind, FailureAction>>(StoreOperation.class);
            table.forEach((operation, row) -> copy.put(operation, new EnumMap<>(row)));
            return new StoreFailurePolicy(copy);
        }
    }
}
