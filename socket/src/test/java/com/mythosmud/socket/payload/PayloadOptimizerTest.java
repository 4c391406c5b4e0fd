package com.mythosmud.socket.payload;

import com.mythosmud.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadOptimizerTest {

    private final PayloadOptimizer optimizer = new PayloadOptimizer(10 * 1024, 100 * 1024, 50 * 1024);

    @Test
    void testBelowThreshold_PassesThroughSameInstance() {
        Map<String, Object> payload = Map.of("message", "hello");

        OptimizedPayload result = optimizer.optimize(payload);

        assertFalse(result.isCompressed());
        assertSame(payload, result.toWire());
    }

    @Test
    void testCompressiblePayload_IsCompressedAndRestorable() {
        Map<String, Object> payload = Map.of("text", "the deep ones gather ".repeat(1000));

        OptimizedPayload result = optimizer.optimize(payload);

        assertTrue(result.isCompressed());
        CompressedPayload compressed = (CompressedPayload) result.toWire();
        assertTrue(compressed.isCompressed());
        assertEquals(optimizer.sizeOf(payload), compressed.getOriginalSize());
        assertTrue(compressed.getCompressionRatio() < 0.1);
        assertEquals(JsonUtils.writeValueAsString(payload), optimizer.decompress(compressed));
    }

    @Test
    void testSmallSaving_KeepsOriginal() {
        PayloadOptimizer eager = new PayloadOptimizer(10, 1000, 1000);
        Map<String, Object> payload = Map.of("k", "xyz123");

        OptimizedPayload result = eager.optimize(payload);

        assertFalse(result.isCompressed());
        assertSame(payload, result.toWire());
    }

    @Test
    void testForced_CompressesEvenBelowThreshold() {
        OptimizedPayload result = optimizer.optimize(Map.of("k", "v"), true);

        assertTrue(result.isCompressed());
    }

    @Test
    void testAboveMax_RejectedWhenCompressedStillTooLarge() {
        PayloadOptimizer strict = new PayloadOptimizer(10, 20, 30);
        Map<String, Object> payload = Map.of("noise", randomText(200));

        PayloadTooLargeException error = assertThrows(PayloadTooLargeException.class, () -> strict.optimize(payload));

        assertEquals(30, error.getLimit());
        assertTrue(error.getCompressedSize() > 30);
    }

    @Test
    void testAboveMax_AcceptedWhenCompressedFits() {
        PayloadOptimizer strict = new PayloadOptimizer(10, 100, 200);
        Map<String, Object> payload = Map.of("text", "a".repeat(5000));

        assertTrue(strict.optimize(payload).isCompressed());
    }

    @Test
    void testRequireDeliverable_MatchesOptimize() {
        PayloadOptimizer strict = new PayloadOptimizer(10, 100, 200);
        Map<String, Object> compressible = Map.of("text", "a".repeat(5000));
        Map<String, Object> incompressible = Map.of("noise", randomText(2000));
        Map<String, Object> belowMax = Map.of("noise", randomText(40));

        assertDoesNotThrow(() -> strict.requireDeliverable(compressible));
        assertDoesNotThrow(() -> strict.requireDeliverable(belowMax));
        PayloadTooLargeException error = assertThrows(PayloadTooLargeException.class,
            () -> strict.requireDeliverable(incompressible));
        assertEquals(200, error.getLimit());
        assertThrows(PayloadTooLargeException.class, () -> strict.optimize(incompressible));
    }

    @Test
    void testIncremental_NoPreviousReturnsCurrent() {
        Map<String, Object> current = Map.of("hp", 10);

        assertSame(current, optimizer.incremental(current, null));
    }

    @Test
    void testIncremental_ChangesAndRemovals() {
        Map<String, Object> previous = new LinkedHashMap<>();
        previous.put("hp", 10);
        previous.put("sanity", 50);
        previous.put("room", "lobby");
        Map<String, Object> current = new LinkedHashMap<>();
        current.put("hp", 8);
        current.put("sanity", 50);
        current.put("status", "bleeding");

        Map<String, Object> delta = optimizer.incremental(current, previous);

        assertEquals(true, delta.get("incremental"));
        assertEquals(Map.of("hp", 8, "status", "bleeding"), delta.get("changes"));
        assertEquals(List.of("room"), delta.get("removed"));
    }

    private static String randomText(int length) {
        Random random = new Random(42);
        StringBuilder text = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            text.append((char) ('!' + random.nextInt(90)));
        }
        return text.toString();
    }
}
