package com.mythosmud.core.redis;

/**
 * Redis keyspace shared with the game server.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions (mute:, dlq:)</li>
 *   <li>Mute sets are owned by the game server; the relay only reads them</li>
 *   <li>Dead-letter lists are capped so a long outage cannot grow them without bound</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Players muted by a listener: {@code mute:players:{listenerId}}
     * <p>
     * <b>Type:</b> Set of speaker player ids
     * </p>
     *
     * @param listenerId player doing the muting
     * @return Redis key
     */
    public static String mutedPlayers(String listenerId) {
        return "mute:players:" + listenerId;
    }

    /**
     * Channels muted by a listener: {@code mute:channels:{listenerId}}
     * <p>
     * <b>Type:</b> Set of channel wire names (say, global, ...)
     * </p>
     *
     * @param listenerId player doing the muting
     * @return Redis key
     */
    public static String mutedChannels(String listenerId) {
        return "mute:channels:" + listenerId;
    }

    /**
     * Dead-letter list of a node: {@code dlq:{nodeId}}
     * <p>
     * <b>Type:</b> List of JSON dead-letter entries, newest last
     * <br>
     * <b>Retention:</b> trimmed to the configured capacity on every push
     * </p>
     *
     * @param nodeId node identifier
     * @return Redis key
     */
    public static String deadLetters(String nodeId) {
        return "dlq:" + nodeId;
    }

}
