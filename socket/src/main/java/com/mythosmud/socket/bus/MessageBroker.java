package com.mythosmud.socket.bus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Transport underneath {@link DistributedEventBus}.
 * <p>
 * Every node sees every published message, its own included. Filtering by subject and by
 * origin happens above this seam.
 * </p>
 */
public interface MessageBroker {

    Mono<Void> start();

    /**
     * Publishes one message. The Mono errors if the broker did not accept it.
     */
    Mono<Void> publish(String subject, String payload);

    /**
     * Hot stream of all messages on the broadcast channel.
     */
    Flux<BrokerMessage> messages();

    Mono<Void> stop();
}
