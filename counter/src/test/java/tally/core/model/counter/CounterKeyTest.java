package tally.core.model.counter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CounterKey")
class CounterKeyTest {

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject blank keys")
        void shouldRejectBlankKeys() {
            assertThrows(IllegalArgumentException.class, () -> new CounterKey("  ", 60));
            assertFalse(CounterKey.isValid("", 60));
            assertFalse(CounterKey.isValid(null, 60));
        }

        @Test
        @DisplayName("should reject non-positive and non-finite windows")
        void shouldRejectBadWindows() {
            assertThrows(IllegalArgumentException.class, () -> new CounterKey("k", 0));
            assertThrows(IllegalArgumentException.class, () -> new CounterKey("k", -5));
            assertFalse(CounterKey.isValid("k", Double.NaN));
            assertFalse(CounterKey.isValid("k", Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("should accept fractional windows")
        void shouldAcceptFractionalWindows() {
            assertTrue(CounterKey.isValid("k", 0.25));
        }
    }

    @Nested
    @DisplayName("windowLabel")
    class WindowLabelTests {

        @Test
        @DisplayName("should render integral windows without a fraction")
        void shouldRenderIntegralWindows() {
            assertEquals("300", new CounterKey("k", 300).windowLabel());
            assertEquals("86400", new CounterKey("k", 86_400.0).windowLabel());
        }

        @Test
        @DisplayName("should render fractional windows as decimals")
        void shouldRenderFractionalWindows() {
            assertEquals("1.5", new CounterKey("k", 1.5).windowLabel());
        }
    }
}
