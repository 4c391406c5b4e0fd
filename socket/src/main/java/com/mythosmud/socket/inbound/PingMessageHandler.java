package com.mythosmud.socket.inbound;

import reactor.core.publisher.Mono;

import java.util.Map;

public class PingMessageHandler implements InboundMessageHandler {

    @Override
    public Mono<Void> handle(InboundContext context, Map<String, Object> data) {
        return Mono.fromRunnable(() -> context.reply("pong", Map.of()));
    }
}
