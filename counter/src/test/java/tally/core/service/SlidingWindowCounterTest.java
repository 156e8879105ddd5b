package tally.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tally.adapter.out.store.memory.InMemoryAtomicCounterStore;
import tally.core.model.counter.CounterOutcome;
import tally.core.model.store.CounterStoreException;
import tally.core.model.store.StoreErrorKind;
import tally.core.model.store.TouchResult;
import tally.core.port.out.AtomicCounterStore;
import tally.core.port.out.CounterMetrics;
import tally.mock.MutableClock;

@DisplayName("SlidingWindowCounter")
@ExtendWith(MockitoExtension.class)
class SlidingWindowCounterTest {

    private static final long NOW = 1_700_000_000L;

    @Mock
    private CounterMetrics metrics;

    private MutableClock clock;

    @BeforeEach
    void setUpClock() {
        clock = MutableClock.atEpochSecond(NOW);
    }

    @Nested
    @DisplayName("Against a working store")
    class WorkingStoreTests {

        private InMemoryAtomicCounterStore store;
        private SlidingWindowCounter counter;

        @BeforeEach
        void setUp() {
            store = new InMemoryAtomicCounterStore(clock, Duration.ZERO);
            store.initialize(List.of());
            counter = new SlidingWindowCounter(store, metrics, clock);
        }

        @AfterEach
        void tearDown() {
            store.close();
        }

        @Test
        @DisplayName("should count a single increment")
        void shouldCountSingleIncrement() {
            assertEquals(1, counter.increment("k", 60));
            assertEquals(1, counter.query("k", 60));
            verify(metrics).recordIncrement(CounterOutcome.OK);
            verify(metrics).recordQuery(CounterOutcome.OK);
        }

        @Test
        @DisplayName("should sum increments within one bucket")
        void shouldSumIncrementsWithinBucket() {
            long last = 0;
            for (int i = 0; i < 5; i++) {
                last = counter.increment("k", 1800);
            }

            assertEquals(5, last);
            assertEquals(5, counter.query("k", 1800));
        }

        @Test
        @DisplayName("should sum increments across buckets in the window")
        void shouldSumAcrossBuckets() {
            counter.increment("k", 60);
            clock.advance(Duration.ofSeconds(10));
            counter.increment("k", 60);
            clock.advance(Duration.ofSeconds(10));

            assertEquals(3, counter.increment("k", 60));
        }

        @Test
        @DisplayName("should forget occurrences once the window has passed")
        void shouldForgetOldOccurrences() {
            counter.increment("k", 60);

            clock.advance(Duration.ofSeconds(62));

            assertEquals(0, counter.query("k", 60));
        }

        @Test
        @DisplayName("should count login attempts in per-second buckets")
        void shouldCountLoginAttempts() {
            for (int i = 0; i < 5; i++) {
                counter.increment("acct:123:login_attempts", 300);
            }

            assertEquals(5, counter.query("acct:123:login_attempts", 300));
            assertEquals(Optional.of("5"), store.get("acct:123:login_attempts:w300:b1700000000"));
        }

        @Test
        @DisplayName("should keep windows of the same key independent")
        void shouldKeepWindowsIndependent() {
            counter.increment("k", 60);
            counter.increment("k", 60);
            counter.increment("k", 3600);

            assertEquals(2, counter.query("k", 60));
            assertEquals(1, counter.query("k", 3600));
        }

        @Test
        @DisplayName("should count concurrent first increments on a fresh key")
        void shouldCountConcurrentFirstIncrements() throws Exception {
            var executor = Executors.newFixedThreadPool(2);
            var start = new CountDownLatch(1);
            try {
                Callable<Long> task = () -> {
                    start.await();
                    return counter.increment("fresh", 60);
                };
                var futures = new ArrayList<Future<Long>>();
                futures.add(executor.submit(task));
                futures.add(executor.submit(task));
                start.countDown();

                for (var future : futures) {
                    var result = future.get(5, TimeUnit.SECONDS);
                    assertTrue(result == 1 || result == 2, "unexpected count " + result);
                }
            } finally {
                executor.shutdownNow();
            }

            var total = counter.query("fresh", 60);
            assertTrue(total == 1 || total == 2, "unexpected total " + total);
        }

        @Test
        @DisplayName("should skip buckets holding non-numeric values")
        void shouldSkipUndecodableBuckets() {
            store.set("k:w60:b1700000000", "abc", Duration.ZERO);
            store.set("k:w60:b1699999999", "2", Duration.ZERO);

            assertEquals(2, counter.query("k", 60));
            verify(metrics).recordDecodeSkip();
        }

        @Test
        @DisplayName("should return 0 when the bucket cannot be incremented even after retry")
        void shouldReturnZeroWhenRetryFails() {
            store.set("k:w60:b1700000000", "abc", Duration.ZERO);

            assertEquals(0, counter.increment("k", 60));
            verify(metrics).recordIncrement(CounterOutcome.ERROR);
        }

        @Test
        @DisplayName("should reject invalid counters without touching the store")
        void shouldRejectInvalidCounters() {
            assertEquals(0, counter.increment(" ", 60));
            assertEquals(0, counter.query("k", 0));

            verify(metrics).recordIncrement(CounterOutcome.ERROR);
            verify(metrics).recordQuery(CounterOutcome.ERROR);
            assertEquals(0, store.entryCount());
        }

        @Test
        @DisplayName("should reject windows spanning too many buckets without touching the store")
        void shouldRejectOversizedWindows() {
            assertEquals(0, counter.increment("k", 1e12));
            assertEquals(0, counter.query("k", 1e12));

            verify(metrics).recordIncrement(CounterOutcome.ERROR);
            verify(metrics).recordQuery(CounterOutcome.ERROR);
            verify(metrics, never()).recordBucketReads(anyInt());
            assertEquals(0, store.entryCount());
        }
    }

    @Nested
    @DisplayName("Against a failing store")
    class FailingStoreTests {

        private static final String BUCKET = "k:w60:b1700000000";

        @Mock
        private AtomicCounterStore store;

        private SlidingWindowCounter counter;

        @BeforeEach
        void setUp() {
            counter = new SlidingWindowCounter(store, metrics, clock);
        }

        @Test
        @DisplayName("should exit early when the store is not initialized")
        void shouldExitEarlyWhenUninitialized() {
            when(store.isInitialized()).thenReturn(false);

            assertEquals(0, counter.increment("k", 60));
            assertEquals(0, counter.query("k", 60));

            verify(metrics).recordIncrement(CounterOutcome.EXIT_EARLY);
            verify(metrics).recordQuery(CounterOutcome.EXIT_EARLY);
            verify(store, never()).increment(anyString());
        }

        @Test
        @DisplayName("should return 0 with an error metric when every store call fails")
        void shouldReturnZeroWhenStoreFails() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(anyString())).thenThrow(transientFailure("incr"));
            when(store.addIfAbsent(anyString(), anyLong(), any())).thenThrow(transientFailure("set_nx"));

            assertEquals(0, counter.increment("k", 60));

            verify(metrics).recordIncrement(CounterOutcome.ERROR);
            verify(store, never()).getMulti(anyCollection());
        }

        @Test
        @DisplayName("should answer 0 to a query when every store call fails")
        void shouldAnswerZeroToQueryWhenStoreFails() {
            when(store.isInitialized()).thenReturn(true);
            when(store.getMulti(anyCollection())).thenThrow(transientFailure("mget"));
            when(store.get(anyString())).thenThrow(transientFailure("get"));

            assertEquals(0, counter.query("k", 60));
            verify(metrics).recordQuery(CounterOutcome.DEGRADED);
        }

        @Test
        @DisplayName("should fall back to add-if-absent when increment fails")
        void shouldFallBackToAddIfAbsent() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenThrow(transientFailure("incr"));
            when(store.addIfAbsent(eq(BUCKET), eq(1L), any())).thenReturn(true);
            when(store.getMulti(anyCollection())).thenReturn(Map.of(BUCKET, "1"));

            assertEquals(1, counter.increment("k", 60));
            verify(metrics).recordIncrement(CounterOutcome.OK);
        }

        @Test
        @DisplayName("should increment again when add-if-absent loses the creation race")
        void shouldRetryIncrementAfterLosingRace() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenThrow(transientFailure("incr")).thenReturn(OptionalLong.of(2));
            when(store.addIfAbsent(eq(BUCKET), eq(1L), any())).thenReturn(false);
            when(store.getMulti(anyCollection())).thenReturn(Map.of(BUCKET, "2"));

            assertEquals(2, counter.increment("k", 60));

            verify(metrics).recordIncrement(CounterOutcome.OK);
            verify(store, never()).touch(anyString(), any());
        }

        @Test
        @DisplayName("should return 0 when the bucket is still missing after add-if-absent")
        void shouldReturnZeroWhenBucketStaysMissing() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenReturn(OptionalLong.empty());
            when(store.addIfAbsent(eq(BUCKET), eq(1L), any())).thenReturn(false);

            assertEquals(0, counter.increment("k", 60));

            verify(metrics).recordIncrement(CounterOutcome.ERROR);
            verify(store, never()).getMulti(anyCollection());
        }

        @Test
        @DisplayName("should overwrite the new bucket when the store cannot touch")
        void shouldOverwriteWhenTouchUnsupported() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenReturn(OptionalLong.of(1));
            when(store.touch(BUCKET, Duration.ofSeconds(120))).thenReturn(TouchResult.UNSUPPORTED);
            when(store.getMulti(anyCollection())).thenReturn(Map.of(BUCKET, "1"));

            assertEquals(1, counter.increment("k", 60));

            verify(store).set(BUCKET, "1", Duration.ofSeconds(120));
        }

        @Test
        @DisplayName("should overwrite the new bucket when touch fails")
        void shouldOverwriteWhenTouchFails() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenReturn(OptionalLong.of(1));
            when(store.touch(BUCKET, Duration.ofSeconds(120))).thenThrow(transientFailure("pexpire"));
            when(store.getMulti(anyCollection())).thenReturn(Map.of(BUCKET, "1"));

            assertEquals(1, counter.increment("k", 60));

            verify(store).set(BUCKET, "1", Duration.ofSeconds(120));
        }

        @Test
        @DisplayName("should only set the ttl on the first increment of a bucket")
        void shouldSetTtlOnlyOnFirstIncrement() {
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(BUCKET)).thenReturn(OptionalLong.of(2));
            when(store.getMulti(anyCollection())).thenReturn(Map.of(BUCKET, "2"));

            assertEquals(2, counter.increment("k", 60));

            verify(store).isInitialized();
            verify(store).increment(BUCKET);
            verify(store).getMulti(anyCollection());
            verifyNoMoreInteractions(store);
        }

        @Test
        @DisplayName("should cap the bucket ttl with the requested maximum")
        void shouldCapTtlWithMaximum() {
            var bucket = "k:w300:b1700000000";
            when(store.isInitialized()).thenReturn(true);
            when(store.increment(bucket)).thenReturn(OptionalLong.of(1));
            when(store.touch(bucket, Duration.ofSeconds(301))).thenReturn(TouchResult.TOUCHED);
            when(store.getMulti(anyCollection())).thenReturn(Map.of(bucket, "1"));

            assertEquals(1, counter.increment("k", 300, OptionalDouble.of(5)));

            verify(store, never()).set(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("should read buckets one by one when the batched read fails")
        void shouldDegradeToIndividualReads() {
            when(store.isInitialized()).thenReturn(true);
            when(store.getMulti(anyCollection())).thenThrow(transientFailure("mget"));
            when(store.get(anyString())).thenReturn(Optional.empty());
            when(store.get("k:w2:b1700000000")).thenReturn(Optional.of("3"));
            when(store.get("k:w2:b1699999998")).thenThrow(transientFailure("get"));

            assertEquals(3, counter.query("k", 2));
            verify(metrics).recordQuery(CounterOutcome.DEGRADED);
        }
    }

    private static CounterStoreException transientFailure(String operation) {
        return new CounterStoreException(StoreErrorKind.TRANSIENT, operation, "connection refused");
    }
}
