package com.mythosmud.socket.mute;

import com.mythosmud.core.channel.ChannelType;
import reactor.core.publisher.Mono;

/**
 * Read-only view of per-player mute preferences.
 */
public interface MuteListLookup {

    /**
     * Lookup that never mutes anyone.
     */
    MuteListLookup NONE = (listener, speaker, channel) -> Mono.just(false);

    /**
     * Whether {@code listener} should not receive {@code speaker}'s messages on {@code channel}.
     * <p>
     * Implementations never error for a missing listener; they answer {@code false}.
     * </p>
     *
     * @param listener player about to receive the frame
     * @param speaker  player that produced the frame, may be null for system events
     * @param channel  channel the frame travels on
     */
    Mono<Boolean> isMuted(String listener, String speaker, ChannelType channel);
}
