package com.mythosmud.socket.payload;

import lombok.Value;

/**
 * Result of {@link PayloadOptimizer#optimize(Object)}.
 * <p>
 * When not compressed, {@link #toWire()} returns the caller's payload instance untouched.
 * </p>
 */
@Value
public class OptimizedPayload {
    Object wire;
    boolean compressed;
    int originalSize;

    static OptimizedPayload passThrough(Object payload, int originalSize) {
        return new OptimizedPayload(payload, false, originalSize);
    }

    static OptimizedPayload compressed(CompressedPayload payload) {
        return new OptimizedPayload(payload, true, payload.getOriginalSize());
    }

    public Object toWire() {
        return wire;
    }
}
