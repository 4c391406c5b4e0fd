package com.mythosmud.socket.http;

import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.bus.IEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.metrics.PrometheusMetricsExporter;
import com.mythosmud.socket.stream.StreamHandler;
import com.mythosmud.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * HTTP server for client transports, health checks, metrics and dead-letter inspection.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final StreamHandler streamHandler;
    private final IEventBus eventBus;
    private final PrometheusMetricsExporter metricsExporter;
    private final BooleanSupplier ready;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                .get("/readyz", (req, res) -> {
                    if (!ready.getAsBoolean()) {
                        return res.status(503).sendString(Mono.just("Not Ready"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/admin/dead-letters", (req, res) ->
                    res.header("Content-Type", "application/json")
                        .sendString(eventBus.deadLetters()
                            .collectList()
                            .map(JsonUtils::writeValueAsString))
                )
                .get("/ws", upgradeHandler::handle)
                .get("/stream", streamHandler::open)
                .post("/stream/send", streamHandler::send)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
