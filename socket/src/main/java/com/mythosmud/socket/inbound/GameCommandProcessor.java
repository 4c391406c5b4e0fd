package com.mythosmud.socket.inbound;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Game logic that executes player commands. The result map is sent back to the player
 * as the data of a {@code command_response} event.
 */
public interface GameCommandProcessor {

    Mono<Map<String, Object>> process(String playerId, String command, List<String> args);

    /**
     * Processor for nodes that run without game logic attached.
     */
    static GameCommandProcessor unavailable() {
        return (playerId, command, args) -> Mono.just(Map.of(
            "result", "Command '" + command + "' is not available right now"
        ));
    }
}
