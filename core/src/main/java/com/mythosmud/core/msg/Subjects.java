package com.mythosmud.core.msg;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.List;
import java.util.Optional;

/**
 * Broker subject naming.
 * <p>
 * Subjects are dot-separated token paths. Room-scoped traffic is addressed by the room's
 * zone and sub-zone so a node only needs one subscription per sub-zone it has occupants in.
 * </p>
 * <p>
 * Room ids follow {@code {plane}_{zone}_{sub_zone}_{room...}}, for example
 * {@code earth_arkhamcity_northside_intersection_derby_high} lives in zone {@code arkhamcity}
 * and sub-zone {@code northside}.
 * </p>
 */
public final class Subjects {
    private Subjects() {
    }

    /**
     * Reserved subject for global chat.
     */
    public static final String GLOBAL = "global";

    /**
     * Reserved subject for system and admin announcements.
     */
    public static final String SYSTEM = "system";

    /**
     * Prefix for room-scoped subjects: {@code room.{zone}.{sub_zone}}.
     */
    public static final String ROOM_PREFIX = "room";

    private static final Splitter ROOM_ID_SPLITTER = Splitter.on('_');
    private static final int ZONE_INDEX = 1;
    private static final int SUB_ZONE_INDEX = 2;
    private static final int MIN_ROOM_ID_PARTS = 4;

    private static final CharMatcher SUBJECT_SAFE = CharMatcher.inRange('a', 'z')
        .or(CharMatcher.inRange('A', 'Z'))
        .or(CharMatcher.inRange('0', '9'))
        .or(CharMatcher.anyOf("_-"));

    /**
     * Zone and sub-zone parsed from a room id.
     */
    public record ZoneAddress(String zone, String subZone) {
    }

    /**
     * Parses zone and sub-zone from a room id.
     *
     * @param roomId room identifier, may be null
     * @return the address, or empty when the id does not follow the zone layout
     */
    public static Optional<ZoneAddress> parseRoomId(String roomId) {
        if (Strings.isNullOrEmpty(roomId)) {
            return Optional.empty();
        }
        List<String> parts = ROOM_ID_SPLITTER.splitToList(roomId);
        if (parts.size() < MIN_ROOM_ID_PARTS) {
            return Optional.empty();
        }
        String zone = parts.get(ZONE_INDEX);
        String subZone = parts.get(SUB_ZONE_INDEX);
        if (zone.isEmpty() || subZone.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ZoneAddress(zone, subZone));
    }

    /**
     * Subject for room-scoped traffic.
     * <p>
     * Ids that do not follow the zone layout get a subject of their own,
     * {@code room.{sanitized_room_id}}, so they still fan out across nodes.
     * </p>
     *
     * @param roomId non-empty room identifier
     * @return subject such as {@code room.arkhamcity.northside}
     */
    public static String forRoom(String roomId) {
        if (Strings.isNullOrEmpty(roomId)) {
            throw new IllegalArgumentException("roomId must not be empty");
        }
        return parseRoomId(roomId)
            .map(address -> ROOM_PREFIX + "." + sanitize(address.zone()) + "." + sanitize(address.subZone()))
            .orElseGet(() -> ROOM_PREFIX + "." + sanitize(roomId));
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_-]} so a token never contains the
     * {@code .} separator or a wildcard.
     */
    static String sanitize(String token) {
        return SUBJECT_SAFE.negate().replaceFrom(token, '-');
    }
}
