package com.mythosmud.socket.mute;

import com.mythosmud.core.channel.ChannelType;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local mute lists, for single-node setups without Redis.
 */
public class InMemoryMuteListLookup implements MuteListLookup {
    private final Map<String, Set<String>> mutedPlayers = new ConcurrentHashMap<>();
    private final Map<String, Set<ChannelType>> mutedChannels = new ConcurrentHashMap<>();

    public void mutePlayer(String listener, String speaker) {
        mutedPlayers.computeIfAbsent(listener, k -> ConcurrentHashMap.newKeySet()).add(speaker);
    }

    public void muteChannel(String listener, ChannelType channel) {
        mutedChannels.computeIfAbsent(listener, k -> ConcurrentHashMap.newKeySet()).add(channel);
    }

    public void unmuteAll(String listener) {
        mutedPlayers.remove(listener);
        mutedChannels.remove(listener);
    }

    @Override
    public Mono<Boolean> isMuted(String listener, String speaker, ChannelType channel) {
        boolean channelMuted = mutedChannels.getOrDefault(listener, Set.of()).contains(channel);
        boolean playerMuted = speaker != null && mutedPlayers.getOrDefault(listener, Set.of()).contains(speaker);
        return Mono.just(channelMuted || playerMuted);
    }
}
