package com.mythosmud.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration MAX = Duration.ofSeconds(30);

    @Test
    void testDoublesWithoutJitter() {
        assertEquals(Duration.ofSeconds(1), JitterBackoff.next(0, BASE, MAX, Duration.ZERO));
        assertEquals(Duration.ofSeconds(2), JitterBackoff.next(1, BASE, MAX, Duration.ZERO));
        assertEquals(Duration.ofSeconds(8), JitterBackoff.next(3, BASE, MAX, Duration.ZERO));
    }

    @Test
    void testCappedAtMax() {
        assertEquals(MAX, JitterBackoff.next(10, BASE, MAX, Duration.ZERO));
        assertEquals(MAX, JitterBackoff.next(200, BASE, MAX, Duration.ZERO));
    }

    @Test
    void testJitterStaysInBounds() {
        for (int i = 0; i < 100; i++) {
            Duration delay = JitterBackoff.next(2, BASE, MAX, Duration.ofMillis(250));
            assertTrue(delay.toMillis() >= 4000 && delay.toMillis() <= 4250, "delay " + delay);
        }
    }
}
