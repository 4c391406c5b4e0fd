package com.mythosmud.socket.mute;

import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.redis.Keys;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Mute lookup backed by two Redis sets per listener: muted player ids and muted channel names.
 * <p>
 * A lookup error is treated as "not muted" so a Redis hiccup never silences a room.
 * </p>
 */
public class RedisMuteListLookup implements MuteListLookup {
    private static final Logger log = LoggerFactory.getLogger(RedisMuteListLookup.class);

    private final RedisReactiveCommands<String, String> commands;

    public RedisMuteListLookup(RedisReactiveCommands<String, String> commands) {
        this.commands = commands;
    }

    @Override
    public Mono<Boolean> isMuted(String listener, String speaker, ChannelType channel) {
        Mono<Boolean> channelMuted = commands.sismember(Keys.mutedChannels(listener), channel.getWireName());
        Mono<Boolean> playerMuted = speaker == null
            ? Mono.just(false)
            : commands.sismember(Keys.mutedPlayers(listener), speaker);

        return Mono.zip(channelMuted.defaultIfEmpty(false), playerMuted.defaultIfEmpty(false))
            .map(both -> both.getT1() || both.getT2())
            .onErrorResume(err -> {
                log.warn("Mute lookup failed for listener {}: {}", listener, err.getMessage());
                return Mono.just(false);
            });
    }
}
