package com.mythosmud.socket.ws;

import com.mythosmud.core.util.BytesUtils;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.ConnectionHandleFactory;
import com.mythosmud.socket.connection.IConnectionRegistry;
import com.mythosmud.socket.connection.TransportType;
import com.mythosmud.socket.inbound.InboundMessageHandlerFactory;
import com.mythosmud.socket.metrics.MetricsService;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket connection lifecycle for one player.
 * <p>
 * Protocol (server → client): envelopes, {@code error} frames, possibly compressed payloads.
 * Protocol (client → server): {@code {type, data}} frames handled by
 * {@link InboundMessageHandlerFactory}.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final SocketConfig config;
    private final IConnectionRegistry registry;
    private final ConnectionHandleFactory handleFactory;
    private final InboundMessageHandlerFactory inboundFactory;
    private final MetricsService metricsService;

    public WebSocketHandler(SocketConfig config,
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

    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String playerId) {
        MDC.put("playerId", playerId);
        ConnectionHandle handle = handleFactory.create(playerId, TransportType.WEBSOCKET);
        registry.register(handle);
        log.debug("WebSocket connected for player {} ({})", playerId, handle.getConnectionId());

        handleConnectionStateUpdates(inbound, outbound, handle);

        return Mono.when(
                outbound.sendString(handle.outbound()),
                handleInboundMessages(inbound, handle)
            )
            .onErrorResume(err -> {
                log.error("WebSocket error for player {}", playerId, err);
                return outbound.sendClose();
            })
            .doFinally(signal -> {
                registry.unregister(handle);
                MDC.remove("playerId");
            });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound,
                                              ConnectionHandle handle) {
        inbound.withConnection(connection -> {
            handle.onInvalidate(connection::dispose);
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingIntervalInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingIntervalInMillis, () -> connection.outbound().sendObject(
                    Mono.just(new PingWebSocketFrame())
                ).then().subscribe())
                .onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
                .onDispose(() -> {
                    log.debug("WebSocket connection disposed for player {}", handle.getPlayerId());
                    registry.unregister(handle);
                });
        });
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, ConnectionHandle handle) {
        return handleInboundFrames(inbound.aggregateFrames().receiveFrames(), handle);
    }

    /**
     * Text frames go to the inbound factory; pongs only refresh liveness; other control frames
     * are left to reactor-netty.
     */
    Mono<Void> handleInboundFrames(Flux<WebSocketFrame> frames, ConnectionHandle handle) {
        return frames
            .filter(frame -> {
                if (frame instanceof PongWebSocketFrame) {
                    registry.touch(handle);
                    return false;
                }
                return frame instanceof TextWebSocketFrame;
            })
            // frames are released after onNext, copy the text before buffering
            .map(frame -> ((TextWebSocketFrame) frame).text())
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .doOnNext(frame -> metricsService.recordNetworkInboundClient(
                TransportType.WEBSOCKET.getLabel(), BytesUtils.getBytesLength(frame)))
            .concatMap(frame -> inboundFactory.handle(handle, frame))
            .doOnError(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", handle.getPlayerId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then();
    }
}
