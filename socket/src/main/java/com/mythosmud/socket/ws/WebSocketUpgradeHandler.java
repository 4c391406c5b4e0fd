package com.mythosmud.socket.ws;

import com.mythosmud.socket.http.PlayerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Optional;

/**
 * Resolves the player before upgrading {@code GET /ws} to a WebSocket.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler) {
        this.wsHandler = wsHandler;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        Optional<String> playerId = PlayerIdentity.resolve(req);
        if (playerId.isEmpty()) {
            log.warn("Rejecting WebSocket upgrade from {} without player id", req.remoteAddress());
            return res.status(401).sendString(Mono.just("Missing player id")).then();
        }
        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, playerId.get()));
    }
}
