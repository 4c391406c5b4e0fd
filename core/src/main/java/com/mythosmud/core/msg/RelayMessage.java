package com.mythosmud.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Unit of cross-node fan-out carried by the message broker.
 * <p>
 * Every node consumes the broadcast stream, so a node receives its own publications back.
 * Receivers compare {@code originNodeId} with their own id and skip their own messages,
 * since the origin already delivered locally.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage {

    @JsonProperty("subject")
    String subject;

    @JsonProperty("origin_node_id")
    String originNodeId;

    @JsonProperty("channel")
    String channel;

    @JsonProperty("route")
    BroadcastRoute route;

    @JsonProperty("envelope")
    Envelope envelope;

    /**
     * Epoch millis when the origin node handed the message to the bus.
     */
    @JsonProperty("published_at")
    long publishedAt;

    @JsonCreator
    public RelayMessage(
        @JsonProperty("subject") String subject,
        @JsonProperty("origin_node_id") String originNodeId,
        @JsonProperty("channel") String channel,
        @JsonProperty("route") BroadcastRoute route,
        @JsonProperty("envelope") Envelope envelope,
        @JsonProperty("published_at") long publishedAt
    ) {
        this.subject = subject;
        this.originNodeId = originNodeId;
        this.channel = channel;
        this.route = route == null ? BroadcastRoute.EMPTY : route;
        this.envelope = envelope;
        this.publishedAt = publishedAt;
    }
}
