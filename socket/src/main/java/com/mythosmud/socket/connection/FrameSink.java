package com.mythosmud.socket.connection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Bounded outbound queue between the registry and a transport.
 * <p>
 * Producers call {@link #tryEmit(String)}; the transport subscribes to {@link #frames()} and
 * drains on its own event loop.
 * </p>
 */
public interface FrameSink {

    Sinks.EmitResult tryEmit(String frame);

    void complete();

    Flux<String> frames();
}
