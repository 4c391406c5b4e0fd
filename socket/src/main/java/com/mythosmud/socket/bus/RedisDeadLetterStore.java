package com.mythosmud.socket.bus;

import com.mythosmud.core.redis.Keys;
import com.mythosmud.core.util.JsonUtils;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Dead letters kept in a capped Redis list per node, so they survive a node restart.
 */
public class RedisDeadLetterStore implements DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(RedisDeadLetterStore.class);

    private final RedisReactiveCommands<String, String> commands;
    private final String key;
    private final int capacity;

    public RedisDeadLetterStore(RedisReactiveCommands<String, String> commands, String nodeId, int capacity) {
        this.commands = commands;
        this.key = Keys.deadLetters(nodeId);
        this.capacity = capacity;
    }

    @Override
    public Mono<Void> store(DeadLetterEntry entry) {
        return commands.rpush(key, JsonUtils.writeValueAsString(entry))
            .then(commands.ltrim(key, -capacity, -1))
            .then()
            .doOnError(err -> log.error("Failed to persist dead letter {} to Redis", entry.getId(), err));
    }

    @Override
    public Flux<DeadLetterEntry> entries() {
        return commands.lrange(key, 0, -1)
            .concatMap(json -> {
                try {
                    return Mono.just(JsonUtils.readValue(json, DeadLetterEntry.class));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping unreadable dead letter in {}: {}", key, e.getMessage());
                    return Mono.empty();
                }
            });
    }

    @Override
    public Mono<Long> size() {
        return commands.llen(key);
    }
}
