package tally.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import tally.core.model.store.FailureAction;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.StoreOperation;

@DisplayName("StoreFailurePolicy")
class StoreFailurePolicyTest {

    private final StoreFailurePolicy policy = StoreFailurePolicy.standard();

    @ParameterizedTest(name = "{0} on uninitialized store returns default")
    @EnumSource(StoreOperation.class)
    void shouldReturnDefaultWhenUninitialized(StoreOperation operation) {
        assertEquals(FailureAction.RETURN_DEFAULT, policy.actionFor(operation, StoreErrorKind.UNINITIALIZED));
    }

    @Test
    @DisplayName("should retry failed increments once")
    void shouldRetryIncrements() {
        assertEquals(FailureAction.RETRY_ONCE, policy.actionFor(StoreOperation.INCREMENT, StoreErrorKind.TRANSIENT));
        assertEquals(FailureAction.RETRY_ONCE, policy.actionFor(StoreOperation.INCREMENT, StoreErrorKind.DECODE));
    }

    @Test
    @DisplayName("should degrade ttl refresh and batched reads")
    void shouldDegrade() {
        assertEquals(FailureAction.DEGRADE, policy.actionFor(StoreOperation.TTL_REFRESH, StoreErrorKind.TRANSIENT));
        assertEquals(FailureAction.DEGRADE, policy.actionFor(StoreOperation.WINDOW_READ, StoreErrorKind.TRANSIENT));
    }

    @Test
    @DisplayName("should skip unreadable buckets")
    void shouldSkipBuckets() {
        assertEquals(FailureAction.SKIP, policy.actionFor(StoreOperation.BUCKET_READ, StoreErrorKind.TRANSIENT));
        assertEquals(FailureAction.SKIP, policy.actionFor(StoreOperation.BUCKET_READ, StoreErrorKind.DECODE));
    }

    @Test
    @DisplayName("should fall back to default for unlisted combinations")
    void shouldFallBackToDefault() {
        var custom = StoreFailurePolicy.builder()
                .on(StoreOperation.INCREMENT, StoreErrorKind.TRANSIENT, FailureAction.RETRY_ONCE)
                .build();

        assertEquals(FailureAction.RETURN_DEFAULT, custom.actionFor(StoreOperation.WINDOW_READ, StoreErrorKind.TRANSIENT));
        assertEquals(FailureAction.RETURN_DEFAULT, custom.actionFor(StoreOperation.INCREMENT, StoreErrorKind.DECODE));
        assertEquals(FailureAction.RETURN_DEFAULT, policy.actionFor(StoreOperation.WINDOW_READ, StoreErrorKind.DECODE));
    }
}
