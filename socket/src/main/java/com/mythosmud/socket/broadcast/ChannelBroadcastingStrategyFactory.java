package com.mythosmud.socket.broadcast;

import com.google.common.base.Strings;
import com.mythosmud.core.channel.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves channel names to strategies.
 * <p>
 * Every {@link ChannelType} has a strategy from construction on. Lookups ignore case and
 * surrounding whitespace; unregistered names get an {@link UnknownChannelStrategy} that keeps
 * the name as given.
 * </p>
 */
public class ChannelBroadcastingStrategyFactory {
    private static final Logger log = LoggerFactory.getLogger(ChannelBroadcastingStrategyFactory.class);

    private final Map<String, ChannelBroadcastingStrategy> strategies = new ConcurrentHashMap<>();

    public ChannelBroadcastingStrategyFactory() {
        for (ChannelType type : ChannelType.values()) {
            strategies.put(type.getWireName(), defaultStrategy(type));
        }
    }

    private static ChannelBroadcastingStrategy defaultStrategy(ChannelType type) {
        return switch (type.getFamily()) {
            case ROOM_LOCAL -> new RoomBasedChannelStrategy(type);
            case GLOBAL -> new GlobalChannelStrategy();
            case PARTY -> new PartyChannelStrategy();
            case WHISPER -> new WhisperChannelStrategy();
            case SYSTEM_ADMIN -> new SystemAdminChannelStrategy(type);
        };
    }

    public ChannelBroadcastingStrategy getStrategy(String channelType) {
        ChannelBroadcastingStrategy strategy = strategies.get(normalize(channelType));
        if (strategy != null) {
            return strategy;
        }
        log.debug("No strategy registered for channel '{}'", channelType);
        return new UnknownChannelStrategy(channelType);
    }

    public ChannelBroadcastingStrategy getStrategy(ChannelType channelType) {
        return getStrategy(channelType.getWireName());
    }

    /**
     * Adds or replaces the strategy for a channel name.
     */
    public void registerStrategy(String channelType, ChannelBroadcastingStrategy strategy) {
        String key = normalize(channelType);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Channel name must not be empty");
        }
        ChannelBroadcastingStrategy previous = strategies.put(key, strategy);
        log.info("Registered strategy {} for channel '{}'{}", strategy.getClass().getSimpleName(), key,
            previous == null ? "" : " (replacing " + previous.getClass().getSimpleName() + ")");
    }

    private static String normalize(String channelType) {
        return Strings.nullToEmpty(channelType).trim().toLowerCase(Locale.ROOT);
    }
}
