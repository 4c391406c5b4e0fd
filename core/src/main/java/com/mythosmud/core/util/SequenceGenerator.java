package com.mythosmud.core.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues strictly increasing sequence numbers per sender.
 * <p>
 * Events without a sender share the {@value #SYSTEM_SENDER} counter. Counters live for the
 * lifetime of the node; a restarted node starts over at 1, which clients see as a new stream.
 * </p>
 */
public class SequenceGenerator {
    public static final String SYSTEM_SENDER = "system";

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public long next(String senderId) {
        String key = senderId == null || senderId.isBlank() ? SYSTEM_SENDER : senderId;
        return counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    public int trackedSenders() {
        return counters.size();
    }
}
