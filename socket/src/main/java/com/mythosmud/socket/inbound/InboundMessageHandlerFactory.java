package com.mythosmud.socket.inbound;

import com.mythosmud.core.msg.ErrorType;
import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.IConnectionRegistry;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.payload.PayloadTooLargeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches inbound client frames {@code {type, data}} to the handler registered for
 * {@code type}.
 * <p>
 * Every rejected frame gets exactly one error frame back on the connection it came from:
 * malformed JSON is {@code invalid_format}, an unknown or missing type is
 * {@code invalid_command}, a failing handler is {@code message_processing_error}.
 * </p>
 */
public class InboundMessageHandlerFactory {
    private static final Logger log = LoggerFactory.getLogger(InboundMessageHandlerFactory.class);

    private final BroadcastCoordinator coordinator;
    private final IConnectionRegistry registry;
    private final MetricsService metricsService;
    private final Map<String, InboundMessageHandler> handlers = new ConcurrentHashMap<>();

    public InboundMessageHandlerFactory(BroadcastCoordinator coordinator,
                                        IConnectionRegistry registry,
                                        GameCommandProcessor commandProcessor,
                                        MetricsService metricsService) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.metricsService = metricsService;

        CommandMessageHandler commandHandler = new CommandMessageHandler(commandProcessor);
        handlers.put("command", commandHandler);
        handlers.put("game_command", commandHandler);
        handlers.put("chat", new ChatMessageHandler(registry));
        handlers.put("ping", new PingMessageHandler());
    }

    public void registerHandler(String type, InboundMessageHandler handler) {
        handlers.put(type, handler);
        log.info("Registered inbound handler {} for '{}'", handler.getClass().getSimpleName(), type);
    }

    /**
     * Handles one raw frame. The returned Mono never errors.
     */
    public Mono<Void> handle(ConnectionHandle connection, String rawFrame) {
        return Mono.defer(() -> {
            InboundContext context = new InboundContext(connection, coordinator);
            registry.touch(connection);

            Map<String, Object> frame;
            try {
                frame = JsonUtils.readMap(rawFrame);
            } catch (IllegalArgumentException e) {
                log.warn("Malformed frame from {}: {}", connection.getPlayerId(), e.getMessage());
                return reject(context, ErrorType.INVALID_FORMAT, "Invalid JSON format", Map.of());
            }
            if (frame == null) {
                return reject(context, ErrorType.INVALID_FORMAT, "Invalid JSON format", Map.of());
            }

            String type = frame.get("type") instanceof String s ? s : null;
            InboundMessageHandler handler = type == null ? null : handlers.get(type);
            if (handler == null) {
                log.warn("Unknown message type '{}' from {}", type, connection.getPlayerId());
                Map<String, Object> details = new HashMap<>();
                details.put("player_id", connection.getPlayerId());
                details.put("message_type", type);
                String message = type == null ? "Missing message type" : "Unknown message type: " + type;
                return reject(context, ErrorType.INVALID_COMMAND, message, details);
            }

            Object rawData = frame.get("data");
            if (rawData != null && !(rawData instanceof Map)) {
                return reject(context, ErrorType.INVALID_FORMAT, "Message data must be an object", Map.of());
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> data = rawData == null ? Collections.emptyMap() : (Map<String, Object>) rawData;

            return Mono.defer(() -> handler.handle(context, data))
                .onErrorResume(PayloadTooLargeException.class, err -> reject(context, ErrorType.PAYLOAD_TOO_LARGE,
                    err.getMessage(), Map.of("limit", err.getLimit())))
                .onErrorResume(err -> {
                    log.error("Error handling '{}' from {}", type, connection.getPlayerId(), err);
                    return reject(context, ErrorType.MESSAGE_PROCESSING_ERROR,
                        "Error processing message: " + err.getMessage(), Map.of("message_type", type));
                });
        });
    }

    private Mono<Void> reject(InboundContext context, ErrorType errorType, String message, Map<String, Object> details) {
        metricsService.recordInboundRejected(errorType);
        context.replyError(errorType, message, details);
        return Mono.empty();
    }
}
