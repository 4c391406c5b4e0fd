package com.mythosmud.socket.stream;

import com.mythosmud.core.util.BytesUtils;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.ConnectionHandleFactory;
import com.mythosmud.socket.connection.IConnectionRegistry;
import com.mythosmud.socket.connection.TransportType;
import com.mythosmud.socket.http.PlayerIdentity;
import com.mythosmud.socket.inbound.InboundMessageHandlerFactory;
import com.mythosmud.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.Optional;

/**
 * Server-sent events fallback transport.
 * <p>
 * {@code GET /stream} opens the event stream, {@code POST /stream/send} carries one inbound
 * frame for the player's open stream. Keepalive comments double as liveness: a dead client
 * fails the write and the handle is removed.
 * </p>
 */
public class StreamHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamHandler.class);

    private final SocketConfig config;
    private final IConnectionRegistry registry;
    private final ConnectionHandleFactory handleFactory;
    private final InboundMessageHandlerFactory inboundFactory;
    private final MetricsService metricsService;

    public StreamHandler(SocketConfig config,
                         IConnectionRegistry registry,
                         ConnectionHandleFactory handleFactory,
                         InboundMessageHandlerFactory inboundFactory,
                         MetricsService metricsService) {
        this.config = config;
        this.registry = registry;
        this.handleFactory = handleFactory;
        this.inboundFactory = inboundFactory;
        this.metricsService = metricsService;
    }

    public Mono<Void> open(HttpServerRequest req, HttpServerResponse res) {
        Optional<String> playerId = PlayerIdentity.resolve(req);
        if (playerId.isEmpty()) {
            return res.status(401).sendString(Mono.just("Missing player id")).then();
        }

        ConnectionHandle handle = handleFactory.create(playerId.get(), TransportType.STREAM);
        registry.register(handle);
        handle.onInvalidate(() -> res.withConnection(Connection::dispose));
        log.debug("Event stream opened for player {} ({})", playerId.get(), handle.getConnectionId());

        Flux<String> events = handle.outbound().map(frame -> "data: " + frame + "\n\n");
        Flux<String> keepalive = Flux.interval(Duration.ofSeconds(config.getPingInterval()))
            .takeWhile(tick -> handle.isOpen())
            .doOnNext(tick -> registry.touch(handle))
            .map(tick -> ": keepalive\n\n");

        return res.header("Content-Type", "text/event-stream")
            .header("Cache-Control", "no-cache")
            .header("X-Accel-Buffering", "no")
            .sendString(Flux.merge(events, keepalive))
            .then()
            .doFinally(signal -> {
                log.debug("Event stream closed for player {} ({})", playerId.get(), signal);
                registry.unregister(handle);
            });
    }

    public Mono<Void> send(HttpServerRequest req, HttpServerResponse res) {
        Optional<String> playerId = PlayerIdentity.resolve(req);
        if (playerId.isEmpty()) {
            return res.status(401).sendString(Mono.just("Missing player id")).then();
        }
        Optional<ConnectionHandle> handle = registry.findHandle(playerId.get(), TransportType.STREAM);
        if (handle.isEmpty()) {
            return res.status(409).sendString(Mono.just("No open event stream")).then();
        }

        return req.receive()
            .aggregate()
            .asString()
            .defaultIfEmpty("")
            .flatMap(frame -> {
                metricsService.recordNetworkInboundClient(TransportType.STREAM.getLabel(), BytesUtils.getBytesLength(frame));
                return inboundFactory.handle(handle.get(), frame);
            })
            .then(res.status(202).send());
    }
}
