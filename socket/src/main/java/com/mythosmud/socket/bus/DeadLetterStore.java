package com.mythosmud.socket.bus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface DeadLetterStore {

    Mono<Void> store(DeadLetterEntry entry);

    /**
     * Stored entries, oldest first.
     */
    Flux<DeadLetterEntry> entries();

    Mono<Long> size();
}
