package tally.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.OptionalDouble;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tally.adapter.in.dto.IncrementWindowRequest;
import tally.adapter.in.dto.WindowCountRequest;
import tally.core.port.in.WindowCounting;

@DisplayName("VelocityCounterResource")
@ExtendWith(MockitoExtension.class)
class VelocityCounterResourceTest {

    @Mock
    private WindowCounting counting;

    private VelocityCounterResource resource;

    @BeforeEach
    void setUp() {
        resource = new VelocityCounterResource(counting);
    }

    @Nested
    @DisplayName("POST /counters/increment")
    class IncrementTests {

        @Test
        @DisplayName("should increment and return the window count")
        void shouldIncrement() {
            when(counting.increment("acct:1", 300.0, OptionalDouble.empty())).thenReturn(4L);

            var response = resource.increment(new IncrementWindowRequest("acct:1", 300.0, null, null));

            assertEquals("acct:1", response.key());
            assertEquals(300.0, response.windowSeconds());
            assertEquals(4L, response.count());
        }

        @Test
        @DisplayName("should pass the ttl maximum through")
        void shouldPassMaxTtl() {
            when(counting.increment("k", 60.0, OptionalDouble.of(90))).thenReturn(1L);

            assertEquals(1L, resource.increment(new IncrementWindowRequest("k", 60.0, 90.0, null)).count());
        }

        @Test
        @DisplayName("should not count when a condition is false")
        void shouldNotCountWhenGated() {
            var response = resource.increment(new IncrementWindowRequest("k", 60.0, null, List.of(true, false)));

            assertEquals(0L, response.count());
            verify(counting, never()).increment(anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("should reject invalid counters with 400")
        void shouldRejectInvalidCounters() {
            var problem = assertThrows(
                    HttpProblem.class, () -> resource.increment(new IncrementWindowRequest("", 60.0, null, null)));
            assertEquals(400, problem.getStatusCode());

            var missingWindow = assertThrows(
                    HttpProblem.class, () -> resource.increment(new IncrementWindowRequest("k", null, null, null)));
            assertEquals(400, missingWindow.getStatusCode());
        }

        @Test
        @DisplayName("should reject windows spanning too many buckets with 400")
        void shouldRejectOversizedWindows() {
            var problem = assertThrows(
                    HttpProblem.class, () -> resource.increment(new IncrementWindowRequest("k", 1e12, null, null)));

            assertEquals(400, problem.getStatusCode());
            verify(counting, never()).increment(anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("should reject a missing body with 400")
        void shouldRejectMissingBody() {
            var problem = assertThrows(HttpProblem.class, () -> resource.increment(null));

            assertEquals(400, problem.getStatusCode());
        }
    }

    @Nested
    @DisplayName("POST /counters/query")
    class QueryTests {

        @Test
        @DisplayName("should return the window count")
        void shouldQuery() {
            when(counting.query("k", 60.0)).thenReturn(9L);

            assertEquals(9L, resource.query(new WindowCountRequest("k", 60.0, null)).count());
        }

        @Test
        @DisplayName("should report 0 when a condition is false")
        void shouldReportZeroWhenGated() {
            assertEquals(0L, resource.query(new WindowCountRequest("k", 60.0, List.of(false))).count());
            verify(counting, never()).query(anyString(), anyDouble());
        }
    }
}
