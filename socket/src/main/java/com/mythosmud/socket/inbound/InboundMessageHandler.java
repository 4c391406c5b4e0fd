package com.mythosmud.socket.inbound;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Handles one inbound frame type. Errors signalled by the returned Mono are reported to the
 * client by the factory.
 */
public interface InboundMessageHandler {

    Mono<Void> handle(InboundContext context, Map<String, Object> data);
}
