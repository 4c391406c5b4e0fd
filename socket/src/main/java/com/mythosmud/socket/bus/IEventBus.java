package com.mythosmud.socket.bus;

import com.mythosmud.core.msg.RelayMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Cross-node pub/sub for relay messages.
 */
public interface IEventBus {

    /**
     * Starts consuming broker messages for subscriptions.
     */
    Mono<Void> start();

    /**
     * Enqueues a message for delivery to every node. Never blocks on the broker.
     *
     * @return false only when the bus is closed
     */
    boolean publish(String subject, RelayMessage message);

    /**
     * Registers a callback for subjects matching {@code pattern}.
     *
     * @throws IllegalArgumentException for a malformed pattern
     */
    BusSubscription subscribe(String pattern, Consumer<RelayMessage> callback);

    Flux<DeadLetterEntry> deadLetters();

    void close();
}
