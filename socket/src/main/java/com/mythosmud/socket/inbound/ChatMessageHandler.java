package com.mythosmud.socket.inbound;

import com.google.common.base.Strings;
import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.ErrorType;
import com.mythosmud.socket.connection.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handles {@code chat} frames: says {@code message} in the player's current room and confirms
 * with {@code chat_sent}.
 */
public class ChatMessageHandler implements InboundMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatMessageHandler.class);

    private final IConnectionRegistry registry;

    public ChatMessageHandler(IConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Mono<Void> handle(InboundContext context, Map<String, Object> data) {
        return Mono.defer(() -> {
            String playerId = context.getPlayerId();
            String message = data.get("message") instanceof String s ? s : null;
            if (Strings.isNullOrEmpty(message) || message.isBlank()) {
                context.replyError(ErrorType.INVALID_COMMAND, "Empty chat message", Map.of("player_id", playerId));
                return Mono.empty();
            }

            Optional<String> roomId = registry.currentRoom(playerId);
            if (roomId.isEmpty()) {
                log.warn("Chat from {} while not in a room, not broadcasting", playerId);
                context.reply("chat_sent", Map.of("message", "Message sent"));
                return Mono.empty();
            }

            Map<String, Object> chat = new LinkedHashMap<>();
            chat.put("player_id", playerId);
            chat.put("message", message);
            Envelope envelope = context.getCoordinator()
                .newEnvelope("chat", chat, playerId, ChannelType.SAY.getWireName())
                .toBuilder()
                .playerId(playerId)
                .build();

            return context.getCoordinator().publish(envelope, BroadcastRoute.toRoom(roomId.get(), playerId))
                .doOnNext(result -> context.reply("chat_sent", Map.of("message", "Message sent")))
                .then();
        });
    }
}
