package com.mythosmud.socket.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * In-process broker. Buses sharing one instance behave like nodes sharing a cluster.
 */
public class LocalMessageBroker implements MessageBroker {
    private static final Logger log = LoggerFactory.getLogger(LocalMessageBroker.class);

    private final Sinks.Many<BrokerMessage> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public Mono<Void> start() {
        log.info("Local message broker started");
        return Mono.empty();
    }

    @Override
    public Mono<Void> publish(String subject, String payload) {
        return Mono.fromRunnable(() -> sink.emitNext(
            new BrokerMessage(subject, payload),
            Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100))
        ));
    }

    @Override
    public Flux<BrokerMessage> messages() {
        return sink.asFlux();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(sink::tryEmitComplete);
    }
}
