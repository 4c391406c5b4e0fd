package com.mythosmud.core.channel;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of delivery channels known to the broadcasting pipeline.
 * <p>
 * Each channel belongs to a {@link Family}; strategies are chosen per family, so adding a
 * new room-local verb only needs a new constant here.
 * </p>
 */
public enum ChannelType {
    SAY("say", Family.ROOM_LOCAL),
    LOCAL("local", Family.ROOM_LOCAL),
    EMOTE("emote", Family.ROOM_LOCAL),
    POSE("pose", Family.ROOM_LOCAL),
    GLOBAL("global", Family.GLOBAL),
    PARTY("party", Family.PARTY),
    WHISPER("whisper", Family.WHISPER),
    SYSTEM("system", Family.SYSTEM_ADMIN),
    ADMIN("admin", Family.SYSTEM_ADMIN);

    public enum Family {
        ROOM_LOCAL,
        GLOBAL,
        PARTY,
        WHISPER,
        SYSTEM_ADMIN
    }

    private static final Map<String, ChannelType> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ChannelType::getWireName, Function.identity()));

    private final String wireName;
    private final Family family;

    ChannelType(String wireName, Family family) {
        this.wireName = wireName;
        this.family = family;
    }

    public String getWireName() {
        return wireName;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * Resolves a wire name, ignoring case and surrounding whitespace.
     *
     * @param wireName raw channel string, may be null
     * @return the channel, or empty for unrecognized names
     */
    public static Optional<ChannelType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT)));
    }
}
