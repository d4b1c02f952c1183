package com.story.knowledge.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    @Test
    @DisplayName("Should double the delay per attempt without jitter")
    void testExponentialGrowth() {
        BackoffCalculator calculator = new BackoffCalculator(50, 1000, 0.0);
        assertEquals(50, calculator.calculate(1));
        assertEquals(100, calculator.calculate(2));
        assertEquals(200, calculator.calculate(3));
        assertEquals(400, calculator.calculate(4));
    }

    @Test
    @DisplayName("Should cap the delay at maxDelay")
    void testCap() {
        BackoffCalculator calculator = new BackoffCalculator(50, 1000, 0.2);
        assertEquals(1000, calculator.calculate(10));
        assertEquals(1000, calculator.calculate(64));
    }

    @Test
    @DisplayName("Should keep jitter within the configured factor")
    void testJitterBounds() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.5);
        for (int i = 0; i < 100; i++) {
            long delay = calculator.calculate(2);
            assertTrue(delay >= 200 && delay <= 300, "delay out of bounds: " + delay);
        }
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 100, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(100, 50, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(10, 100, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator().calculate(0));
    }
}
