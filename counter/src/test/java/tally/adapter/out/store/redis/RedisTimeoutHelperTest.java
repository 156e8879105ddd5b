package tally.adapter.out.store.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.StoreTimeoutException;
import tally.core.port.out.CounterMetrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String STORE_NAME = "redis";
    private static final String OPERATION_NAME = "incr";

    @Mock
    private CounterMetrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, STORE_NAME);
    }

    @Test
    @DisplayName("should return result when operation completes within timeout")
    void shouldReturnResultWithinTimeout() {
        final var result = helper.await(Uni.createFrom().item("success"), OPERATION_NAME);

        assertEquals("success", result);
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("should pass through nil replies")
    void shouldPassThroughNilReplies() {
        assertNull(helper.await(Uni.createFrom().nullItem(), OPERATION_NAME));
    }

    @Test
    @DisplayName("should throw a transient timeout when operation times out")
    void shouldThrowTimeout() {
        final var operation = Uni.createFrom().<String>nothing();

        final var exception = assertThrows(StoreTimeoutException.class, () -> helper.await(operation, OPERATION_NAME));

        assertEquals(StoreErrorKind.TRANSIENT, exception.kind());
        assertEquals(OPERATION_NAME, exception.operation());
        assertEquals(STORE_NAME, exception.store());
        verify(metrics).recordStoreTimeout(STORE_NAME, OPERATION_NAME);
    }

    @Test
    @DisplayName("should translate client failures into transient store errors")
    void shouldTranslateFailures() {
        final var operation = Uni.createFrom().<String>failure(new IllegalStateException("Connection refused"));

        final var exception = assertThrows(CounterStoreException.class, () -> helper.await(operation, OPERATION_NAME));

        assertEquals(StoreErrorKind.TRANSIENT, exception.kind());
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertTrue(exception.getMessage().contains(OPERATION_NAME));
        verify(metrics).recordStoreFailure(STORE_NAME, OPERATION_NAME);
    }

    @Test
    @DisplayName("should work without metrics")
    void shouldWorkWithoutMetrics() {
        final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, STORE_NAME);

        assertThrows(
                StoreTimeoutException.class,
                () -> withoutMetrics.await(Uni.createFrom().<String>nothing(), OPERATION_NAME));
    }
}
