package com.mythosmud.core.channel;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A raw channel string paired with its resolved {@link ChannelType}.
 * <p>
 * Unrecognized legacy strings stay representable: {@link #isUnknown()} is true and
 * {@link #getRaw()} keeps the original text so it can be logged and echoed back.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ChannelKind {
    private final String raw;
    @Nullable
    private final ChannelType type;

    private ChannelKind(String raw, @Nullable ChannelType type) {
        this.raw = raw;
        this.type = type;
    }

    public static ChannelKind of(String raw) {
        String value = raw == null ? "" : raw;
        return new ChannelKind(value, ChannelType.fromWire(value).orElse(null));
    }

    public static ChannelKind of(ChannelType type) {
        return new ChannelKind(type.getWireName(), type);
    }

    public boolean isUnknown() {
        return type == null;
    }

    public Optional<ChannelType> type() {
        return Optional.ofNullable(type);
    }
}
