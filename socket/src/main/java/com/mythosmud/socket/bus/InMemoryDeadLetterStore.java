package com.mythosmud.socket.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded dead-letter buffer; when full the oldest entry is evicted.
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterStore.class);

    private final int capacity;
    private final Deque<DeadLetterEntry> entries = new ArrayDeque<>();

    public InMemoryDeadLetterStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public Mono<Void> store(DeadLetterEntry entry) {
        return Mono.fromRunnable(() -> {
            DeadLetterEntry evicted = null;
            synchronized (entries) {
                if (entries.size() >= capacity) {
                    evicted = entries.pollFirst();
                }
                entries.addLast(entry);
            }
            if (evicted != null) {
                log.warn("Dead-letter store full ({}), evicted entry {} for subject {}",
                    capacity, evicted.getId(), evicted.getSubject());
            }
        });
    }

    @Override
    public Flux<DeadLetterEntry> entries() {
        return Flux.defer(() -> {
            List<DeadLetterEntry> snapshot;
            synchronized (entries) {
                snapshot = new ArrayList<>(entries);
            }
            return Flux.fromIterable(snapshot);
        });
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromSupplier(() -> {
            synchronized (entries) {
                return (long) entries.size();
            }
        });
    }
}
