package com.mythosmud.socket.redis;

import com.mythosmud.socket.config.SocketConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the node's single Lettuce connection.
 * <p>
 * The connection is thread-safe and shared by the mute lookup and the dead-letter store.
 * </p>
 */
public class RedisService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    @Getter
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
