package com.mythosmud.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Routing arguments that accompany an envelope through a channel strategy.
 * <p>
 * Which fields are required depends on the channel: room-local channels need
 * {@code roomId}, whispers need {@code targetPlayerId}, party chat needs {@code partyId}.
 * Strategies validate; this type does not.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BroadcastRoute {

    public static final BroadcastRoute EMPTY = BroadcastRoute.builder().build();

    @JsonProperty("room_id")
    String roomId;

    @JsonProperty("party_id")
    String partyId;

    @JsonProperty("target_player_id")
    String targetPlayerId;

    @JsonProperty("sender_id")
    String senderId;

    @JsonCreator
    public BroadcastRoute(
        @JsonProperty("room_id") String roomId,
        @JsonProperty("party_id") String partyId,
        @JsonProperty("target_player_id") String targetPlayerId,
        @JsonProperty("sender_id") String senderId
    ) {
        this.roomId = roomId;
        this.partyId = partyId;
        this.targetPlayerId = targetPlayerId;
        this.senderId = senderId;
    }

    public static BroadcastRoute toRoom(String roomId, String senderId) {
        return new BroadcastRoute(roomId, null, null, senderId);
    }

    public static BroadcastRoute toPlayer(String targetPlayerId, String senderId) {
        return new BroadcastRoute(null, null, targetPlayerId, senderId);
    }

    public static BroadcastRoute toParty(String partyId, String senderId) {
        return new BroadcastRoute(null, partyId, null, senderId);
    }

    public static BroadcastRoute fromSender(String senderId) {
        return new BroadcastRoute(null, null, null, senderId);
    }
}
