package com.mythosmud.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical event object moving through the broadcasting pipeline.
 * <p>
 * <b>Ordering:</b> {@code sequenceNumber} strictly increases per sender on the node that
 * created the envelope, so clients can detect gaps and reordering.
 * </p>
 * <p>
 * <b>Immutability:</b> the {@code data} map is copied on construction and exposed read-only.
 * Envelopes are created per game event, routed once and then discarded.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {
    /**
     * Event type shown to clients (e.g., "chat_message", "player_entered", "pong").
     */
    @JsonProperty("event_type")
    String eventType;

    /**
     * Creation time, serialized as ISO-8601.
     */
    @JsonProperty("timestamp")
    Instant timestamp;

    /**
     * Per-sender monotonic sequence number.
     */
    @JsonProperty("sequence_number")
    long sequenceNumber;

    /**
     * Event payload (application-specific).
     */
    @JsonProperty("data")
    Map<String, Object> data;

    /**
     * Player the event concerns, if any.
     */
    @JsonProperty("player_id")
    String playerId;

    /**
     * Player that produced the event, absent for system events.
     */
    @JsonProperty("sender_id")
    String senderId;

    /**
     * Raw channel name (say, local, global, whisper, ...).
     */
    @JsonProperty("channel")
    String channel;

    @JsonCreator
    public Envelope(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("sequence_number") long sequenceNumber,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("player_id") String playerId,
        @JsonProperty("sender_id") String senderId,
        @JsonProperty("channel") String channel
    ) {
        this.eventType = eventType;
        this.timestamp = timestamp;
        this.sequenceNumber = sequenceNumber;
        this.data = data == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.playerId = playerId;
        this.senderId = senderId;
        this.channel = channel;
    }
}
